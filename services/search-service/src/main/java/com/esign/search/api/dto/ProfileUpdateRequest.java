package com.esign.search.api.dto;

import com.esign.search.model.PersonalizationProfile;

/**
 * Sections left null keep their stored value. Behavior is derived from tracking and is not
 * writable here.
 */
public class ProfileUpdateRequest {
    private PersonalizationProfile.Preferences preferences;
    private PersonalizationProfile.Contextual contextual;

    public PersonalizationProfile.Preferences getPreferences() {
        return preferences;
    }

    public void setPreferences(PersonalizationProfile.Preferences preferences) {
        this.preferences = preferences;
    }

    public PersonalizationProfile.Contextual getContextual() {
        return contextual;
    }

    public void setContextual(PersonalizationProfile.Contextual contextual) {
        this.contextual = contextual;
    }
}
