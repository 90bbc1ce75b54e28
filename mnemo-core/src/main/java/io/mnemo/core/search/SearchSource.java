package io.mnemo.core.search;

public enum SearchSource {
    KEYWORD,
    VECTOR
}
