package com.deepansh.gateway.accumulate;

import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.JsonSupport;
import com.deepansh.gateway.model.ToolCall;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeMap;

/**
 * Rebuilds complete tool calls from streamed deltas.
 *
 * Each delta addresses a slot by its stream-local index. Non-empty id, type and name
 * overwrite the slot; argument fragments are appended. A slot that gets a name or
 * arguments before any id receives a synthesized {@code call_<hex>} id at once, so
 * the first relayed chunk already carries a stable id.
 *
 * Not thread-safe; one instance per streamed round.
 */
public class StreamingToolCallAccumulator {

    public static final String ID_PREFIX = "call_";

    private static final SecureRandom RANDOM = new SecureRandom();

    /** Told about every id this accumulator invents, so the caller can patch the chunk it forwards. */
    @FunctionalInterface
    public interface IdListener {
        void onIdAssigned(int index, String id);
    }

    private final TreeMap<Integer, Slot> slots = new TreeMap<>();

    private static final class Slot {
        String id;
        String type;
        String name;
        final StringBuilder arguments = new StringBuilder();
    }

    public List<String> processDelta(List<ChatChunk.ToolCallDelta> deltas) {
        return processDelta(deltas, null);
    }

    /**
     * Folds one chunk's tool-call deltas into the slots.
     *
     * @return ids of the slots touched, in delta order (null for slots still without an id)
     */
    public List<String> processDelta(List<ChatChunk.ToolCallDelta> deltas, IdListener listener) {
        List<String> touched = new ArrayList<>();
        if (deltas == null) {
            return touched;
        }
        for (ChatChunk.ToolCallDelta delta : deltas) {
            Slot slot = slots.computeIfAbsent(delta.getIndex(), i -> new Slot());

            if (notEmpty(delta.getId())) {
                slot.id = delta.getId();
            }
            if (notEmpty(delta.getType())) {
                slot.type = delta.getType();
            }
            ChatChunk.FunctionDelta fn = delta.getFunction();
            String name = fn != null ? fn.getName() : null;
            String args = fn != null ? fn.getArguments() : null;
            if (notEmpty(name)) {
                slot.name = name;
            }
            if (notEmpty(args)) {
                slot.arguments.append(args);
            }

            if (slot.id == null && (notEmpty(name) || notEmpty(args))) {
                slot.id = newCallId();
                if (listener != null) {
                    listener.onIdAssigned(delta.getIndex(), slot.id);
                }
            }
            touched.add(slot.id);
        }
        return touched;
    }

    /**
     * Complete calls ordered by index. Slots that never received a name are skipped;
     * unparsable arguments become an empty map. Does not change any state.
     */
    public List<ToolCall> finalizeCalls() {
        List<ToolCall> calls = new ArrayList<>();
        if (slots.isEmpty()) {
            return calls;
        }
        int maxIndex = slots.lastKey();
        for (int i = 0; i <= maxIndex; i++) {
            Slot slot = slots.get(i);
            if (slot == null || !notEmpty(slot.name)) {
                continue;
            }
            calls.add(toCall(i, slot));
        }
        return calls;
    }

    /** Peeks at one slot without finalizing; null if the index was never seen. */
    public ToolCall toolCall(int index) {
        Slot slot = slots.get(index);
        return slot != null ? toCall(index, slot) : null;
    }

    public int count() {
        return slots.size();
    }

    public boolean hasToolCalls() {
        return !slots.isEmpty();
    }

    public void reset() {
        slots.clear();
    }

    static String newCallId() {
        byte[] bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return ID_PREFIX + HexFormat.of().formatHex(bytes);
    }

    private static ToolCall toCall(int index, Slot slot) {
        return ToolCall.builder()
                .index(index)
                .id(slot.id != null ? slot.id : ID_PREFIX + index)
                .type(notEmpty(slot.type) ? slot.type : ToolCall.TYPE_FUNCTION)
                .name(slot.name)
                .arguments(JsonSupport.parseArguments(slot.arguments.toString()))
                .build();
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
