package com.marketpulse.core.model;

/**
 * A fetched web page whose extracted text was kept by the research stage.
 *
 * @param qualityScore heuristic content quality from 0 to 100
 */
public record SourceDocument(
        String url,
        String title,
        String content,
        String query,
        String provider,
        int qualityScore
) implements RawItem {

    @Override
    public String sourceId() {
        return url;
    }

    @Override
    public int contentLength() {
        return content == null ? 0 : content.length();
    }
}
