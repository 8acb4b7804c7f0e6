package com.esign.search.facet;

import com.esign.search.model.EntityType;
import com.esign.search.model.FacetBucket;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.FacetResult;
import com.esign.search.model.FacetSuggestion;
import com.esign.search.model.FacetType;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class FacetEngine {
    static final String HIERARCHY_SEPARATOR = " > ";

    private static final Map<String, String> LABELS = Map.ofEntries(
        Map.entry("type", "Content Type"),
        Map.entry("tags", "Tags"),
        Map.entry("createdAt", "Created Date"),
        Map.entry("updatedAt", "Modified Date"),
        Map.entry("userId", "Author"),
        Map.entry("metadata.fileType", "File Type"),
        Map.entry("metadata.fileSize", "File Size"),
        Map.entry("metadata.pageCount", "Page Count"),
        Map.entry("metadata.language", "Language"),
        Map.entry("metadata.category", "Category"),
        Map.entry("metadata.industry", "Industry"),
        Map.entry("metadata.role", "Role"),
        Map.entry("metadata.department", "Department"),
        Map.entry("status", "Status"),
        Map.entry("isPublic", "Visibility"),
        Map.entry("isActive", "Active Status")
    );

    private static final List<ContextRule> CONTEXT_RULES = List.of(
        new ContextRule(List.of("pdf", "document", "file"), List.of("metadata.fileType", "metadata.fileSize")),
        new ContextRule(List.of("template", "form"), List.of("metadata.category", "isPublic")),
        new ContextRule(List.of("recent", "today", "yesterday"), List.of("createdAt", "updatedAt")),
        new ContextRule(List.of("user", "author", "creator"), List.of("userId", "metadata.role"))
    );

    private final FacetProperties properties;

    public FacetEngine(FacetProperties properties) {
        this.properties = properties;
    }

    public List<FacetDefinition> chooseFacets(SearchQuery query) {
        Set<String> fields = new LinkedHashSet<>();
        if (query.hasFacets()) {
            fields.addAll(query.getFacets());
        } else if (properties.isDynamicFacets()) {
            fields.addAll(properties.getDefaultFields());
            if (query.hasEntityTypes()) {
                for (EntityType type : query.getEntityTypes()) {
                    fields.addAll(properties.getEntityFacets().getOrDefault(type, List.of()));
                }
            }
        } else {
            fields.addAll(properties.getDefaultFields());
        }
        return fields.stream()
            .filter(field -> field != null && !field.isBlank())
            .limit(properties.getMaxFacetFields())
            .map(this::definitionFor)
            .toList();
    }

    FacetDefinition definitionFor(String field) {
        FacetDefinition configured = properties.getDefinitions().get(field);
        if (configured != null) {
            FacetDefinition copy = configured.copy();
            copy.setField(field);
            return copy;
        }
        FacetProperties.RangeFacet range = properties.getRangeFacets().get(field);
        if (range != null) {
            FacetDefinition definition = new FacetDefinition(field, FacetType.RANGE);
            for (RangeSlot slot : slots(range)) {
                definition.getRanges().add(new FacetDefinition.RangeSpec((double) slot.start(), (double) slot.end(), slot.key()));
            }
            return definition;
        }
        if (isDateField(field)) {
            return new FacetDefinition(field, FacetType.DATE_HISTOGRAM);
        }
        FacetDefinition definition = FacetDefinition.terms(field);
        definition.setSize(properties.getMaxFacetValues());
        return definition;
    }

    /**
     * Shapes raw engine buckets in the order facets were requested. Every returned bucket has a
     * count of at least the configured minimum, and no facet carries more than the configured
     * maximum number of buckets.
     */
    public List<FacetResult> postProcess(
        Map<String, List<FacetBucket>> rawFacets,
        SearchQuery query,
        List<FacetDefinition> requested
    ) {
        if (rawFacets == null || rawFacets.isEmpty()) {
            return List.of();
        }
        Map<String, FacetType> types = new LinkedHashMap<>();
        if (requested != null) {
            for (FacetDefinition definition : requested) {
                types.put(definition.getField(), definition.getType());
            }
        }
        for (String field : rawFacets.keySet()) {
            types.putIfAbsent(field, FacetType.TERMS);
        }

        List<FacetResult> results = new ArrayList<>();
        for (Map.Entry<String, FacetType> entry : types.entrySet()) {
            List<FacetBucket> raw = rawFacets.get(entry.getKey());
            if (raw == null) {
                continue;
            }
            results.add(shape(entry.getKey(), entry.getValue(), raw, query));
        }
        return results;
    }

    private FacetResult shape(String field, FacetType type, List<FacetBucket> raw, SearchQuery query) {
        SearchFilter filter = query.getFilters() == null ? null : query.getFilters().get(field);
        List<FacetBucket> buckets = new ArrayList<>();
        for (FacetBucket bucket : raw) {
            FacetBucket copy = new FacetBucket(bucket.getKey(), bucket.getCount());
            copy.setFrom(bucket.getFrom());
            copy.setTo(bucket.getTo());
            buckets.add(copy);
        }

        FacetProperties.RangeFacet range = properties.getRangeFacets().get(field);
        if (range != null && type == FacetType.RANGE) {
            buckets = rebucket(range, buckets);
        } else if (properties.getHierarchicalFields().contains(field)) {
            markSelected(buckets, filter);
            buckets = buildHierarchy(buckets);
        }
        markSelected(buckets, filter);

        int minCount = properties.getFacetMinCount();
        List<FacetBucket> shaped = new ArrayList<>();
        for (FacetBucket bucket : buckets) {
            if (bucket.getCount() < minCount) {
                continue;
            }
            if (bucket.getChildren() != null) {
                bucket.setChildren(bucket.getChildren().stream().filter(child -> child.getCount() >= minCount).toList());
            }
            shaped.add(bucket);
            if (shaped.size() >= properties.getMaxFacetValues()) {
                break;
            }
        }
        return new FacetResult(field, type, shaped);
    }

    private void markSelected(List<FacetBucket> buckets, SearchFilter filter) {
        if (filter == null) {
            return;
        }
        for (FacetBucket bucket : buckets) {
            if (bucket.getSelected() != null) {
                continue;
            }
            boolean selected = filter.getKind() == SearchFilter.Kind.RANGE
                ? rangeMatches(filter, bucket)
                : filter.matchesKey(bucket.getKey());
            bucket.setSelected(selected);
        }
    }

    private boolean rangeMatches(SearchFilter filter, FacetBucket bucket) {
        Object gte = filter.getBounds().get("gte");
        Object lte = filter.getBounds().get("lte");
        return bucket.getFrom() != null
            && gte != null
            && asDouble(gte) == bucket.getFrom()
            && (lte == null || bucket.getTo() == null || asDouble(lte) == bucket.getTo());
    }

    List<FacetBucket> buildHierarchy(List<FacetBucket> flat) {
        Map<String, FacetBucket> parents = new LinkedHashMap<>();
        for (FacetBucket bucket : flat) {
            String key = bucket.getKey();
            int split = key.indexOf(HIERARCHY_SEPARATOR);
            if (split < 0) {
                FacetBucket parent = parents.get(key);
                if (parent == null) {
                    parent = new FacetBucket(key, 0);
                    parents.put(key, parent);
                }
                parent.setCount(parent.getCount() + bucket.getCount());
                if (bucket.isSelected()) {
                    parent.setSelected(true);
                }
                continue;
            }
            String parentKey = key.substring(0, split);
            FacetBucket parent = parents.computeIfAbsent(parentKey, k -> new FacetBucket(k, 0));
            FacetBucket child = new FacetBucket(key.substring(split + HIERARCHY_SEPARATOR.length()), bucket.getCount());
            child.setSelected(bucket.getSelected());
            child.setFullPath(key);
            parent.addChild(child);
            parent.setCount(parent.getCount() + bucket.getCount());
        }
        return new ArrayList<>(parents.values());
    }

    List<FacetBucket> rebucket(FacetProperties.RangeFacet range, List<FacetBucket> existing) {
        List<FacetBucket> buckets = new ArrayList<>();
        for (RangeSlot slot : slots(range)) {
            long count = 0;
            for (FacetBucket bucket : existing) {
                if (slot.covers(bucket)) {
                    count += bucket.getCount();
                }
            }
            if (count > 0) {
                FacetBucket bucket = new FacetBucket(slot.key(), count);
                bucket.setFrom((double) slot.start());
                bucket.setTo((double) slot.end());
                buckets.add(bucket);
            }
        }
        return buckets;
    }

    private List<RangeSlot> slots(FacetProperties.RangeFacet range) {
        List<RangeSlot> slots = new ArrayList<>();
        if (range.getStep() <= 0 || range.getMax() <= range.getMin()) {
            return slots;
        }
        for (long start = range.getMin(); start < range.getMax(); start += range.getStep()) {
            long end = Math.min(start + range.getStep(), range.getMax());
            slots.add(new RangeSlot(start, end));
        }
        return slots;
    }

    public List<FacetSuggestion> suggestFacets(SearchQuery query) {
        List<String> context = new ArrayList<>();
        if (query.hasText()) {
            String text = query.getQuery().toLowerCase(Locale.ROOT);
            for (ContextRule rule : CONTEXT_RULES) {
                if (rule.keywords().stream().anyMatch(text::contains)) {
                    context.addAll(rule.facets());
                }
            }
        }
        if (query.hasEntityTypes()) {
            for (EntityType type : query.getEntityTypes()) {
                context.addAll(properties.getEntityFacets().getOrDefault(type, List.of()));
            }
        }
        List<String> contextFields = new ArrayList<>(new LinkedHashSet<>(context));
        List<String> commonFields = properties.getCommonFields();

        // context priorities start above the highest baseline priority
        int contextTop = commonFields.size() + contextFields.size();
        List<FacetSuggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < contextFields.size(); i++) {
            String field = contextFields.get(i);
            suggestions.add(new FacetSuggestion(field, label(field), suggestionType(field), contextTop - i));
        }
        for (int i = 0; i < commonFields.size(); i++) {
            String field = commonFields.get(i);
            if (!contextFields.contains(field)) {
                suggestions.add(new FacetSuggestion(field, label(field), suggestionType(field), commonFields.size() - i));
            }
        }
        suggestions.sort(Comparator.comparingInt(FacetSuggestion::priority).reversed());
        return suggestions;
    }

    static String label(String field) {
        String known = LABELS.get(field);
        if (known != null) {
            return known;
        }
        String base = field.startsWith("metadata.") ? field.substring("metadata.".length()) : field;
        String spaced = base.replaceAll("([a-z0-9])([A-Z])", "$1 $2").replace('_', ' ');
        if (spaced.isEmpty()) {
            return spaced;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    static String suggestionType(String field) {
        if (field.contains("Date") || field.endsWith("At")) {
            return "date";
        }
        if (field.contains("Size") || field.contains("Count") || field.endsWith("_count")) {
            return "range";
        }
        String base = field.startsWith("metadata.") ? field.substring("metadata.".length()) : field;
        if (base.startsWith("is") || base.contains("Active")) {
            return "boolean";
        }
        return "terms";
    }

    private static boolean isDateField(String field) {
        return field.endsWith("At") || field.endsWith("deadline");
    }

    private static double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private record ContextRule(List<String> keywords, List<String> facets) {
    }

    private record RangeSlot(long start, long end) {
        String key() {
            return start + "-" + end;
        }

        boolean covers(FacetBucket bucket) {
            if (key().equals(bucket.getKey())) {
                return true;
            }
            if (bucket.getFrom() != null) {
                return bucket.getFrom() >= start && bucket.getFrom() < end;
            }
            double numeric = asDouble(bucket.getKey());
            return !Double.isNaN(numeric) && numeric >= start && numeric < end;
        }
    }
}
