package com.search.cache.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchQuery")
class SearchQueryTest {

    private final KeyDeriver deriver = new KeyDeriver();

    @Test
    @DisplayName("Emits every field, with unset optionals as empty strings")
    void emitsEveryField() {
        Map<String, Object> params = SearchQuery.of("java caching").toParams();

        assertEquals(7, params.size());
        assertEquals("java caching", params.get(SearchQuery.QUERY));
        assertEquals("", params.get(SearchQuery.LANGUAGE));
        assertEquals("", params.get(SearchQuery.SAFE_SEARCH));
        assertEquals(1, params.get(SearchQuery.PAGE));
    }

    @Test
    @DisplayName("Engine order does not change the key")
    void engineOrder() {
        SearchQuery a = SearchQuery.builder().query("q").engine("bing").engine("google").build();
        SearchQuery b = SearchQuery.builder().query("q").engine("google").engine("bing").build();

        assertEquals(deriver.derive(a.toParams()), deriver.derive(b.toParams()));
    }

    @Test
    @DisplayName("Page changes the key")
    void pageChangesKey() {
        SearchQuery first = SearchQuery.builder().query("q").page(1).build();
        SearchQuery second = SearchQuery.builder().query("q").page(2).build();

        assertNotEquals(deriver.derive(first.toParams()), deriver.derive(second.toParams()));
    }

    @Test
    @DisplayName("Builder validates its input")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> SearchQuery.builder().build());
        assertThrows(IllegalArgumentException.class, () -> SearchQuery.builder().query(" ").build());
        assertThrows(IllegalArgumentException.class, () -> SearchQuery.builder().page(0));
        assertThrows(IllegalArgumentException.class, () -> SearchQuery.builder().safeSearch(3));
    }
}
