package com.raditha.tokenizer.mapping;

import com.raditha.tokenizer.model.MappingEntry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory association between tokens and the original values they replace.
 * <p>
 * Tokens are the primary key and keep their insertion order, which is also the
 * order they are saved in. A second index from value to token answers "does this
 * value already have a token" without scanning. A mapping belongs to a single
 * run and is not thread-safe.
 */
public class TokenMapping {

    private final Map<String, String> valuesByToken = new LinkedHashMap<>();
    private final Map<String, String> tokensByValue = new HashMap<>();

    /**
     * Record that {@code token} stands for {@code originalValue}.
     * <p>
     * Re-putting a token replaces its value but keeps its position, as a later
     * row in a mapping file overrides an earlier one. When several tokens carry
     * the same value the reverse index points at the earliest of them, so
     * tokenization stays a function.
     */
    public void put(String token, String originalValue) {
        String previous = valuesByToken.put(token, originalValue);
        if (previous == null) {
            tokensByValue.putIfAbsent(originalValue, token);
            return;
        }
        if (previous.equals(originalValue)) {
            return;
        }
        if (token.equals(tokensByValue.get(previous))) {
            tokensByValue.remove(previous);
            reindex(previous);
        }
        // the overwritten token may sit before the one currently indexed for this value
        reindex(originalValue);
    }

    /**
     * Reverse lookup: the token already assigned to a value, if any.
     */
    public Optional<String> tokenFor(String originalValue) {
        return Optional.ofNullable(tokensByValue.get(originalValue));
    }

    /**
     * Forward lookup: the original value behind a token, if the token is known.
     */
    public Optional<String> valueFor(String token) {
        return Optional.ofNullable(valuesByToken.get(token));
    }

    public boolean containsToken(String token) {
        return valuesByToken.containsKey(token);
    }

    public int size() {
        return valuesByToken.size();
    }

    public boolean isEmpty() {
        return valuesByToken.isEmpty();
    }

    /**
     * Entries in insertion order.
     */
    public List<MappingEntry> entries() {
        List<MappingEntry> entries = new ArrayList<>(valuesByToken.size());
        valuesByToken.forEach((token, value) -> entries.add(new MappingEntry(token, value)));
        return entries;
    }

    // earliest token, in insertion order, that carries the value
    private void reindex(String value) {
        for (Map.Entry<String, String> entry : valuesByToken.entrySet()) {
            if (entry.getValue().equals(value)) {
                tokensByValue.put(value, entry.getKey());
                return;
            }
        }
    }
}
