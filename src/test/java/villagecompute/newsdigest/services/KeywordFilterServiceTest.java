package villagecompute.newsdigest.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.newsdigest.TestFixtures;
import villagecompute.newsdigest.api.types.FeedItemType;
import villagecompute.newsdigest.api.types.KeywordRulesType;

/**
 * Tests for keyword pre-filtering.
 */
class KeywordFilterServiceTest {

    private KeywordFilterService service;

    @BeforeEach
    void setUp() {
        service = new KeywordFilterService();
    }

    @Test
    void testFilter_RequiredKeywordMatchesCaseInsensitively() {
        // Given
        FeedItemType matching = TestFixtures.item("OpenAI releases new GPT model", "A breakthrough in ai technology");
        FeedItemType other = TestFixtures.item("Best recipes for summer", "Delicious food ideas");
        KeywordRulesType rules = KeywordRulesType.of(List.of("AI", "LLM"), List.of());

        // When
        List<FeedItemType> result = service.filter(List.of(matching, other), rules);

        // Then
        assertEquals(List.of(matching), result);
    }

    @Test
    void testFilter_BlockedKeywordRejects() {
        FeedItemType sponsored = TestFixtures.item("AI tools roundup", "This post is SPONSORED by Acme");
        FeedItemType clean = TestFixtures.item("AI tools roundup, part 2", "Independent review");
        KeywordRulesType rules = KeywordRulesType.of(List.of("ai"), List.of("sponsored"));

        List<FeedItemType> result = service.filter(List.of(sponsored, clean), rules);

        assertEquals(List.of(clean), result);
    }

    @Test
    void testFilter_TermInBothSetsRejects() {
        FeedItemType item = TestFixtures.item("LLM news", "");
        KeywordRulesType rules = KeywordRulesType.of(List.of("llm"), List.of("LLM"));

        assertTrue(service.filter(List.of(item), rules).isEmpty());
    }

    @Test
    void testFilter_EmptyRequiredAcceptsEverythingNotBlocked() {
        List<FeedItemType> items = List.of(TestFixtures.item("Gardening tips", "Tomatoes"),
                TestFixtures.item("Weather", "Rain tomorrow"), TestFixtures.item("Ad", "advertisement"));
        KeywordRulesType rules = KeywordRulesType.of(List.of(), List.of("advertisement"));

        List<FeedItemType> result = service.filter(items, rules);

        assertEquals(items.subList(0, 2), result);
    }

    @Test
    void testFilter_MatchesAcrossTitleAndBodyJoin() {
        // "machine learning" only exists across the title/body boundary
        FeedItemType item = TestFixtures.item("Advances in machine", "learning systems");
        KeywordRulesType rules = KeywordRulesType.of(List.of("machine learning"), List.of());

        assertEquals(1, service.filter(List.of(item), rules).size());
    }

    @Test
    void testFilter_PreservesOrderWithoutDuplication() {
        List<FeedItemType> items = TestFixtures.items(10);
        KeywordRulesType rules = KeywordRulesType.of(List.of("llm"), List.of("story 3", "story 7"));

        List<FeedItemType> result = service.filter(items, rules);

        assertEquals(8, result.size());
        int previous = -1;
        for (FeedItemType item : result) {
            int index = items.indexOf(item);
            assertTrue(index > previous, "Output must be an order-preserving subsequence");
            previous = index;
        }
    }

    @Test
    void testFilter_EmptyInput() {
        assertTrue(service.filter(List.of(), KeywordRulesType.of(List.of("ai"), List.of())).isEmpty());
    }

    @Test
    void testFilter_BlankTermsIgnored() {
        FeedItemType item = TestFixtures.item("Anything", "at all");
        KeywordRulesType rules = KeywordRulesType.of(List.of(" ", ""), List.of(""));

        assertEquals(List.of(item), service.filter(List.of(item), rules));
    }
}
