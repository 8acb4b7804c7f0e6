package com.esign.search.analytics;

import com.esign.search.model.PersonalizationProfile;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface PersonalizationProfileStore {
    Optional<PersonalizationProfile> find(String userId, String organizationId);

    void save(PersonalizationProfile profile);

    /**
     * Applies {@code change} to the stored profile, creating an empty one first when absent.
     */
    PersonalizationProfile update(String userId, String organizationId, UnaryOperator<PersonalizationProfile> change);
}
