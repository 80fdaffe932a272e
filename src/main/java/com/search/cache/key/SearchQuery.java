package com.search.cache.key;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A search request expressed as the parameters that affect its result.
 *
 * <p>{@link #toParams()} always emits every recognized field so that a request
 * that leaves a field unset and one that sets it explicitly to the default
 * are told apart only by the field's value, never by its absence.</p>
 */
public final class SearchQuery {

    public static final String QUERY = "query";
    public static final String CATEGORIES = "categories";
    public static final String ENGINES = "engines";
    public static final String LANGUAGE = "language";
    public static final String TIME_RANGE = "time_range";
    public static final String SAFE_SEARCH = "safe_search";
    public static final String PAGE = "page";

    private static final int DEFAULT_PAGE = 1;

    private final String query;
    private final Set<String> categories;
    private final Set<String> engines;
    private final String language;
    private final String timeRange;
    private final Integer safeSearch;
    private final int page;

    private SearchQuery(Builder builder) {
        this.query = builder.query;
        this.categories = Collections.unmodifiableSet(new TreeSet<>(builder.categories));
        this.engines = Collections.unmodifiableSet(new TreeSet<>(builder.engines));
        this.language = builder.language;
        this.timeRange = builder.timeRange;
        this.safeSearch = builder.safeSearch;
        this.page = builder.page;
    }

    public static SearchQuery of(String query) {
        return builder().query(query).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQuery() {
        return query;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public Set<String> getEngines() {
        return engines;
    }

    public String getLanguage() {
        return language;
    }

    public String getTimeRange() {
        return timeRange;
    }

    public Integer getSafeSearch() {
        return safeSearch;
    }

    public int getPage() {
        return page;
    }

    /**
     * Returns the parameter map consumed by {@link KeyDeriver}. Unset optional
     * fields are emitted as the empty string.
     */
    public Map<String, Object> toParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(QUERY, query);
        params.put(CATEGORIES, categories);
        params.put(ENGINES, engines);
        params.put(LANGUAGE, language != null ? language : KeyDeriver.NULL_SENTINEL);
        params.put(TIME_RANGE, timeRange != null ? timeRange : KeyDeriver.NULL_SENTINEL);
        params.put(SAFE_SEARCH, safeSearch != null ? safeSearch.toString() : KeyDeriver.NULL_SENTINEL);
        params.put(PAGE, page);
        return params;
    }

    @Override
    public String toString() {
        return "SearchQuery{query='" + query + "', categories=" + categories + ", engines=" + engines
                + ", language=" + language + ", timeRange=" + timeRange + ", safeSearch=" + safeSearch
                + ", page=" + page + "}";
    }

    public static class Builder {
        private String query;
        private final Set<String> categories = new TreeSet<>();
        private final Set<String> engines = new TreeSet<>();
        private String language;
        private String timeRange;
        private Integer safeSearch;
        private int page = DEFAULT_PAGE;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder category(String category) {
            this.categories.add(category);
            return this;
        }

        public Builder categories(Collection<String> categories) {
            this.categories.addAll(categories);
            return this;
        }

        public Builder engine(String engine) {
            this.engines.add(engine);
            return this;
        }

        public Builder engines(Collection<String> engines) {
            this.engines.addAll(engines);
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder timeRange(String timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder safeSearch(int safeSearch) {
            if (safeSearch < 0 || safeSearch > 2) {
                throw new IllegalArgumentException("safeSearch must be 0, 1 or 2");
            }
            this.safeSearch = safeSearch;
            return this;
        }

        public Builder page(int page) {
            if (page < 1) {
                throw new IllegalArgumentException("page must be >= 1");
            }
            this.page = page;
            return this;
        }

        public SearchQuery build() {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("query must not be blank");
            }
            return new SearchQuery(this);
        }
    }
}
