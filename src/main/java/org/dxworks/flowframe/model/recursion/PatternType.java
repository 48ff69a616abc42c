package org.dxworks.flowframe.model.recursion;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType {
    FACTORIAL("factorial"),
    FIBONACCI("fibonacci"),
    TREE_TRAVERSAL("tree-traversal"),
    BINARY_SEARCH("binary-search"),
    MERGE_SORT("merge-sort"),
    QUICK_SORT("quick-sort"),
    GENERIC("generic");

    private final String name;

    PatternType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
