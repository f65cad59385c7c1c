package com.annograph.query.filter;

public enum RetrievalTarget {
    ANNOTATION,
    RELATIONSHIP
}
