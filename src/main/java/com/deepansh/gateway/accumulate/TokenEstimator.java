package com.deepansh.gateway.accumulate;

/**
 * Cheap, reproducible token estimate used when a backend reports no usage.
 *
 * Every whitespace-delimited word costs one token, plus one more per contiguous run of
 * punctuation inside it, so {@code "..."} costs two.
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int tokens = 0;
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            int runs = 0;
            boolean inRun = false;
            for (int i = 0; i < word.length(); ) {
                int cp = word.codePointAt(i);
                if (isPunctuation(cp)) {
                    if (!inRun) {
                        runs++;
                        inRun = true;
                    }
                } else {
                    inRun = false;
                }
                i += Character.charCount(cp);
            }
            tokens += 1 + runs;
        }
        return tokens;
    }

    static boolean isPunctuation(int codePoint) {
        switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }
}
