package com.esign.search.analytics;

import com.esign.search.model.PersonalizationProfile;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

public class InMemoryPersonalizationProfileStore implements PersonalizationProfileStore {
    private final Map<String, PersonalizationProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<PersonalizationProfile> find(String userId, String organizationId) {
        return Optional.ofNullable(profiles.get(key(userId, organizationId)));
    }

    @Override
    public void save(PersonalizationProfile profile) {
        profiles.put(key(profile.getUserId(), profile.getOrganizationId()), profile);
    }

    @Override
    public PersonalizationProfile update(
        String userId,
        String organizationId,
        UnaryOperator<PersonalizationProfile> change
    ) {
        // stored profiles are replaced, never mutated, so readers can hold on to them
        return profiles.compute(key(userId, organizationId), (key, current) -> change.apply(
            current == null ? PersonalizationProfile.empty(userId, organizationId) : current.copy()));
    }

    private static String key(String userId, String organizationId) {
        return organizationId + ":" + userId;
    }
}
