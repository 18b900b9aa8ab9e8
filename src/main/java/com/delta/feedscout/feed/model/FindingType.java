package com.delta.feedscout.feed.model;

public enum FindingType {
    EMPTY_TITLES,
    SHORT_TITLE,
    SPARSE_FEED
}
