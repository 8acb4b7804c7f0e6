package com.esign.search.query;

import com.esign.search.model.EntityType;
import com.esign.search.model.IntentEntity;
import com.esign.search.model.IntentType;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchIntent;
import com.esign.search.model.SearchQuery;
import com.esign.search.model.SortSpec;
import com.esign.search.text.TextToolkit;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies free text against ordered keyword patterns and rewrites the query for confident
 * intents.
 */
@Component
public class IntentRecognizer {
    private static final Logger log = LoggerFactory.getLogger(IntentRecognizer.class);

    static final String TIME_RANGE = "timeRange";
    static final String FILE_TYPE = "fileType";
    static final String AUTHOR = "author";

    private static final List<IntentPattern> PATTERNS = List.of(
        new IntentPattern(Pattern.compile("find|search|look for|show me", Pattern.CASE_INSENSITIVE), IntentType.FIND_DOCUMENT, 0.8),
        new IntentPattern(Pattern.compile("template|form", Pattern.CASE_INSENSITIVE), IntentType.FIND_TEMPLATE, 0.9),
        new IntentPattern(Pattern.compile("user|person|author|created by", Pattern.CASE_INSENSITIVE), IntentType.FIND_BY_AUTHOR, 0.85),
        new IntentPattern(Pattern.compile("recent|latest|new|today|yesterday", Pattern.CASE_INSENSITIVE), IntentType.FIND_RECENT, 0.8),
        new IntentPattern(Pattern.compile("pdf|doc|docx|document|file", Pattern.CASE_INSENSITIVE), IntentType.FIND_BY_TYPE, 0.75)
    );
    private static final List<String> TIME_WORDS = List.of("today", "yesterday", "week", "month", "year");
    private static final Pattern PERSON = Pattern.compile(
        "(?:created by|authored by|by|from|author:?)\\s+(\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+)?)");
    private static final Pattern DATE = Pattern.compile(
        "\\b(\\d{4}-\\d{2}-\\d{2}|today|yesterday|tomorrow|(?:last|this|next) (?:week|month|year)"
            + "|(?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*(?: \\d{1,2})?(?:,? \\d{4})?)\\b",
        Pattern.CASE_INSENSITIVE);

    private final QueryProperties properties;
    private final TextToolkit textToolkit;
    private final Clock clock;

    public IntentRecognizer(QueryProperties properties, TextToolkit textToolkit, Clock clock) {
        this.properties = properties;
        this.textToolkit = textToolkit;
        this.clock = clock;
    }

    public SearchIntent recognize(String text) {
        if (text == null || text.isBlank()) {
            return SearchIntent.unknown();
        }
        IntentType type = IntentType.UNKNOWN;
        double confidence = 0.0;
        for (IntentPattern pattern : PATTERNS) {
            if (pattern.confidence() > confidence && pattern.pattern().matcher(text).find()) {
                type = pattern.type();
                confidence = pattern.confidence();
            }
        }
        List<String> tokens = textToolkit.tokenize(text);
        List<IntentEntity> entities = extractEntities(text, tokens);
        SearchIntent intent = new SearchIntent(type, confidence, entities, extractParameters(type, tokens, entities));
        log.debug("intent recognized type={} confidence={}", type, confidence);
        return intent;
    }

    private List<IntentEntity> extractEntities(String text, List<String> tokens) {
        List<IntentEntity> entities = new ArrayList<>();
        Matcher people = PERSON.matcher(text);
        while (people.find()) {
            entities.add(new IntentEntity(IntentEntity.Kind.PERSON, people.group(1), 0.8));
        }
        Matcher dates = DATE.matcher(text);
        while (dates.find()) {
            entities.add(new IntentEntity(IntentEntity.Kind.DATE, dates.group(1), 0.9));
        }
        for (String token : tokens) {
            if (properties.getDocumentTypes().contains(token)) {
                entities.add(new IntentEntity(IntentEntity.Kind.DOCUMENT_TYPE, token, 0.85));
            }
        }
        return entities;
    }

    private Map<String, String> extractParameters(IntentType type, List<String> tokens, List<IntentEntity> entities) {
        Map<String, String> parameters = new LinkedHashMap<>();
        switch (type) {
            case FIND_RECENT -> tokens.stream()
                .filter(TIME_WORDS::contains)
                .findFirst()
                .ifPresent(token -> parameters.put(TIME_RANGE, token));
            case FIND_BY_TYPE -> tokens.stream()
                .filter(properties.getFileTypes()::contains)
                .findFirst()
                .ifPresent(token -> parameters.put(FILE_TYPE, token));
            case FIND_BY_AUTHOR -> entities.stream()
                .filter(entity -> entity.type() == IntentEntity.Kind.PERSON)
                .findFirst()
                .ifPresent(entity -> parameters.put(AUTHOR, entity.value()));
            default -> {
            }
        }
        return parameters;
    }

    /**
     * Returns a rewritten copy, or {@code query} itself when the intent is below the confidence
     * threshold.
     */
    public SearchQuery apply(SearchQuery query, SearchIntent intent) {
        if (intent == null || intent.confidence() < properties.getIntentConfidenceThreshold()) {
            return query;
        }
        SearchQuery rewritten = query.copy();
        Map<String, SearchFilter> filters = new LinkedHashMap<>(rewritten.getFilters());
        switch (intent.type()) {
            case FIND_TEMPLATE -> rewritten.setEntityTypes(new ArrayList<>(List.of(EntityType.TEMPLATE)));
            case FIND_RECENT -> {
                rewritten.setSort(new SortSpec("createdAt", SortSpec.DESC));
                String timeRange = intent.parameter(TIME_RANGE);
                if (timeRange != null) {
                    filters.put("createdAt", SearchFilter.range(timeRangeStart(timeRange).toString(), null));
                }
            }
            case FIND_BY_TYPE -> {
                String fileType = intent.parameter(FILE_TYPE);
                if (fileType != null) {
                    filters.put("metadata.fileType", SearchFilter.term(fileType));
                }
            }
            case FIND_BY_AUTHOR -> {
                String author = intent.parameter(AUTHOR);
                if (author != null) {
                    filters.put("metadata.author", SearchFilter.term(author));
                }
            }
            default -> {
            }
        }
        rewritten.setFilters(filters);
        return rewritten;
    }

    Instant timeRangeStart(String timeRange) {
        Instant now = clock.instant();
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.ofInstant(now, zone);
        return switch (timeRange) {
            case "today" -> today.atStartOfDay(zone).toInstant();
            case "yesterday" -> today.minusDays(1).atStartOfDay(zone).toInstant();
            case "week" -> now.minus(7, ChronoUnit.DAYS);
            case "month" -> ZonedDateTime.ofInstant(now, zone).minusMonths(1).toInstant();
            default -> now.minus(24, ChronoUnit.HOURS);
        };
    }

    private record IntentPattern(Pattern pattern, IntentType type, double confidence) {
    }
}
