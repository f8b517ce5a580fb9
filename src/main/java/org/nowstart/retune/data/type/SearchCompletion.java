package org.nowstart.retune.data.type;

public enum SearchCompletion {
    FULL,
    REDUCED
}
