package com.example.ample.domain.model;

import java.util.Collections;
import java.util.List;
import lombok.Data;

@Data
public class TrackInfo {

    private static final String LARGE = "large";

    private final String name;

    private final String artistName;

    private final String albumArtist;

    private final String albumTitle;

    private final List<Image> images;

    public TrackInfo(String name, String artistName, String albumArtist, String albumTitle, List<Image> images) {
        this.name = name;
        this.artistName = artistName;
        this.albumArtist = albumArtist;
        this.albumTitle = albumTitle;
        this.images = images == null ? Collections.<Image>emptyList() : Collections.unmodifiableList(images);
    }

    /**
     * URL of the album image sized "large", or empty when LastFM has none.
     */
    public String largeImageUrl() {
        for (Image image : images) {
            if (LARGE.equals(image.getSize())) {
                return image.getUrl() == null ? "" : image.getUrl();
            }
        }
        return "";
    }

    @Data
    public static class Image {

        private final String size;

        private final String url;
    }
}
