package com.marketpulse.core.model;

/**
 * An element of a raw collection that can be summarized without copying its content.
 */
public interface RawItem {

    String sourceId();

    int contentLength();
}
