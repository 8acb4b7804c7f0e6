package com.esign.search.facet;

import static org.assertj.core.api.Assertions.assertThat;

import com.esign.search.model.EntityType;
import com.esign.search.model.FacetBucket;
import com.esign.search.model.FacetDefinition;
import com.esign.search.model.FacetResult;
import com.esign.search.model.FacetSuggestion;
import com.esign.search.model.FacetType;
import com.esign.search.model.SearchFilter;
import com.esign.search.model.SearchQuery;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class FacetEngineTest {

    @Test
    void chooseFacetsCombinesDefaultsWithEntityFacets() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        SearchQuery query = new SearchQuery();
        query.setEntityTypes(List.of(EntityType.DOCUMENT));

        List<FacetDefinition> facets = engine.chooseFacets(query);

        assertThat(facets).extracting(FacetDefinition::getField).containsExactly(
            "type", "tags", "createdAt",
            "metadata.fileType", "metadata.fileSize", "metadata.pageCount", "metadata.language", "status");
        assertThat(facets.get(1).getType()).isEqualTo(FacetType.TERMS);
        assertThat(facets.get(1).getSize()).isEqualTo(50);
        assertThat(facets.get(2).getType()).isEqualTo(FacetType.DATE_HISTOGRAM);

        FacetDefinition fileSize = facets.get(4);
        assertThat(fileSize.getType()).isEqualTo(FacetType.RANGE);
        assertThat(fileSize.getRanges()).hasSize(100);
        assertThat(fileSize.getRanges().get(0).getKey()).isEqualTo("0-1000000");
    }

    @Test
    void chooseFacetsCapsRequestedFields() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        SearchQuery query = new SearchQuery();
        query.setFacets(IntStream.range(0, 12).mapToObj(i -> "field" + i).toList());

        assertThat(engine.chooseFacets(query)).hasSize(10);
    }

    @Test
    void configuredDefinitionWinsOverInference() {
        FacetProperties properties = new FacetProperties();
        FacetDefinition signers = new FacetDefinition("signers", FacetType.NESTED);
        signers.setPath("signers");
        signers.setSubFacets(List.of(FacetDefinition.terms("signers.status")));
        properties.setDefinitions(Map.of("signers", signers));
        FacetEngine engine = new FacetEngine(properties);

        SearchQuery query = new SearchQuery();
        query.setFacets(List.of("signers"));

        FacetDefinition chosen = engine.chooseFacets(query).get(0);
        assertThat(chosen.getType()).isEqualTo(FacetType.NESTED);
        assertThat(chosen).isNotSameAs(signers);
    }

    @Test
    void postProcessDropsSparseBucketsCapsValuesAndMarksSelection() {
        FacetProperties properties = new FacetProperties();
        properties.setFacetMinCount(2);
        properties.setMaxFacetValues(3);
        FacetEngine engine = new FacetEngine(properties);

        SearchQuery query = new SearchQuery();
        query.setFilters(Map.of("status", SearchFilter.term("draft")));
        Map<String, List<FacetBucket>> raw = Map.of("status", List.of(
            new FacetBucket("signed", 5),
            new FacetBucket("void", 1),
            new FacetBucket("draft", 4),
            new FacetBucket("sent", 3),
            new FacetBucket("expired", 2)
        ));

        List<FacetResult> results = engine.postProcess(raw, query, List.of(FacetDefinition.terms("status")));

        List<FacetBucket> buckets = results.get(0).getBuckets();
        assertThat(buckets).extracting(FacetBucket::getKey).containsExactly("signed", "draft", "sent");
        assertThat(buckets).allSatisfy(bucket -> assertThat(bucket.getCount()).isGreaterThanOrEqualTo(2));
        assertThat(buckets.get(1).isSelected()).isTrue();
        assertThat(buckets.get(0).isSelected()).isFalse();
    }

    @Test
    void hierarchicalFieldsGroupChildrenUnderParents() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        SearchQuery query = new SearchQuery();
        query.setFilters(Map.of("tags", SearchFilter.term("Legal > NDA")));
        Map<String, List<FacetBucket>> raw = Map.of("tags", List.of(
            new FacetBucket("Legal > NDA", 3),
            new FacetBucket("Legal > MSA", 2),
            new FacetBucket("Legal", 1),
            new FacetBucket("Finance", 4)
        ));

        List<FacetBucket> buckets = engine.postProcess(raw, query, List.of(FacetDefinition.terms("tags"))).get(0).getBuckets();

        assertThat(buckets).extracting(FacetBucket::getKey).containsExactly("Legal", "Finance");
        FacetBucket legal = buckets.get(0);
        assertThat(legal.getCount()).isEqualTo(6);
        assertThat(legal.getChildren()).extracting(FacetBucket::getKey).containsExactly("NDA", "MSA");
        assertThat(legal.getChildren().get(0).getFullPath()).isEqualTo("Legal > NDA");
        assertThat(legal.getChildren().get(0).isSelected()).isTrue();
        assertThat(legal.getChildren().get(1).isSelected()).isFalse();
    }

    @Test
    void rangeFacetsAreRebucketedIntoConfiguredSlots() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        SearchQuery query = new SearchQuery();
        query.setFilters(Map.of("metadata.pageCount", SearchFilter.range(11, 21)));
        Map<String, List<FacetBucket>> raw = Map.of("metadata.pageCount", List.of(
            new FacetBucket("5", 2),
            new FacetBucket("8", 1),
            new FacetBucket("15", 4)
        ));
        FacetDefinition requested = new FacetDefinition("metadata.pageCount", FacetType.RANGE);

        List<FacetBucket> buckets = engine.postProcess(raw, query, List.of(requested)).get(0).getBuckets();

        assertThat(buckets).extracting(FacetBucket::getKey).containsExactly("1-11", "11-21");
        assertThat(buckets).extracting(FacetBucket::getCount).containsExactly(3L, 4L);
        assertThat(buckets.get(1).isSelected()).isTrue();
        assertThat(buckets.get(0).isSelected()).isFalse();
    }

    @Test
    void postProcessOfEmptyAggregationsIsEmpty() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        assertThat(engine.postProcess(Map.of(), new SearchQuery(), List.of())).isEmpty();
    }

    @Test
    void suggestFacetsRanksContextFieldsAboveCommonOnes() {
        FacetEngine engine = new FacetEngine(new FacetProperties());
        SearchQuery query = new SearchQuery();
        query.setQuery("recent pdf documents");

        List<FacetSuggestion> suggestions = engine.suggestFacets(query);

        assertThat(suggestions).extracting(FacetSuggestion::field).containsExactly(
            "metadata.fileType", "metadata.fileSize", "createdAt", "updatedAt", "type", "tags", "userId");
        assertThat(suggestions.get(0).label()).isEqualTo("File Type");
        assertThat(suggestions.get(1).type()).isEqualTo("range");
        assertThat(suggestions.get(2).type()).isEqualTo("date");
        assertThat(suggestions.get(3).priority()).isGreaterThan(suggestions.get(4).priority());
    }

    @Test
    void unknownFieldsGetReadableLabels() {
        assertThat(FacetEngine.label("metadata.contractValue")).isEqualTo("Contract Value");
        assertThat(FacetEngine.suggestionType("isArchived")).isEqualTo("boolean");
    }
}
