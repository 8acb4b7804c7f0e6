package com.esign.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One indexable unit mirrored from an upstream service. Every document belongs to exactly one
 * organization; {@code permissions} holds ACL tokens of the form {@code public},
 * {@code user:<id>} and {@code org:<id>}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchDocument {
    public static final String PUBLIC_PERMISSION = "public";

    private String id;

    @JsonProperty("type")
    private EntityType entityType;

    private String title;
    private String content;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private String organizationId;
    private String userId;
    private Set<String> tags = new LinkedHashSet<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Set<String> permissions = new LinkedHashSet<>();
    private SearchScore score;
    private Map<String, List<String>> highlight;

    public static String userPermission(String userId) {
        return "user:" + userId;
    }

    public static String organizationPermission(String organizationId) {
        return "org:" + organizationId;
    }

    public boolean isVisibleTo(String organizationId, String userId) {
        if (organizationId == null || !organizationId.equals(this.organizationId)) {
            return false;
        }
        if (userId == null) {
            return true;
        }
        if (userId.equals(this.userId)) {
            return true;
        }
        Set<String> acl = permissions == null ? Set.of() : permissions;
        return acl.contains(PUBLIC_PERMISSION)
            || acl.contains(userPermission(userId))
            || acl.contains(organizationPermission(organizationId));
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public void setEntityType(EntityType entityType) {
        this.entityType = entityType;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags == null ? new LinkedHashSet<>() : tags;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Set<String> getPermissions() {
        return permissions;
    }

    public void setPermissions(Set<String> permissions) {
        this.permissions = permissions == null ? new LinkedHashSet<>() : permissions;
    }

    public SearchScore getScore() {
        return score;
    }

    public void setScore(SearchScore score) {
        this.score = score;
    }

    public Map<String, List<String>> getHighlight() {
        return highlight;
    }

    public void setHighlight(Map<String, List<String>> highlight) {
        this.highlight = highlight;
    }
}
