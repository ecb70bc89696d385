package com.deepansh.gateway.emulation;

/**
 * Event tags of the Responses streaming protocol, exactly as they appear on the wire.
 */
public final class ResponseEventTypes {

    public static final String CREATED = "response.created";
    public static final String IN_PROGRESS = "response.in_progress";
    public static final String OUTPUT_ITEM_ADDED = "response.output_item.added";
    public static final String CONTENT_PART_ADDED = "response.content_part.added";
    public static final String OUTPUT_TEXT_DELTA = "response.output_text.delta";
    public static final String OUTPUT_TEXT_DONE = "response.output_text.done";
    public static final String CONTENT_PART_DONE = "response.content_part.done";
    public static final String OUTPUT_ITEM_DONE = "response.output_item.done";
    public static final String COMPLETED = "response.completed";

    private ResponseEventTypes() {
    }
}
