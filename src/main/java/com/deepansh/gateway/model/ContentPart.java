package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of a multimodal message body: either a text segment or an image reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentPart {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE_URL = "image_url";

    private String type;

    @JsonProperty("text")
    private String text;

    @JsonProperty("image_url")
    private ImageUrl imageUrl;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ImageUrl {
        private String url;
        /** "auto", "low" or "high" */
        private String detail;
    }

    public static ContentPart text(String text) {
        return ContentPart.builder().type(TYPE_TEXT).text(text).build();
    }

    public static ContentPart imageUrl(String url, String detail) {
        return ContentPart.builder().type(TYPE_IMAGE_URL).imageUrl(new ImageUrl(url, detail)).build();
    }

    /** Wraps already base64-encoded image bytes into a data URL part. */
    public static ContentPart imageBase64(String base64Data, String mediaType, String detail) {
        return imageUrl("data:" + mediaType + ";base64," + base64Data, detail);
    }

    @JsonIgnore
    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }

    @JsonIgnore
    public boolean isImage() {
        return TYPE_IMAGE_URL.equals(type);
    }
}
