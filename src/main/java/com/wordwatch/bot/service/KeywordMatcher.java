package com.wordwatch.bot.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Local forbidden-word check run before any remote classification. Words match
 * literally and case-insensitively; a hit is reported as the configured word,
 * whatever its spelling in the text.
 */
public class KeywordMatcher {
    private record Keyword(String word, Pattern pattern) {}

    private final AtomicReference<List<Keyword>> keywords;

    public KeywordMatcher(Collection<String> words) {
        List<Keyword> compiled = new ArrayList<>();
        for (String word : words) {
            String trimmed = word == null ? "" : word.trim();
            if (!trimmed.isEmpty() && indexOf(compiled, trimmed) < 0) {
                compiled.add(compile(trimmed));
            }
        }
        this.keywords = new AtomicReference<>(List.copyOf(compiled));
    }

    public List<String> match(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (Keyword keyword : keywords.get()) {
            if (keyword.pattern().matcher(text).find()) {
                found.add(keyword.word());
            }
        }
        return List.copyOf(found);
    }

    /**
     * @return false if the word was blank or already present
     */
    public boolean add(String word) {
        String trimmed = word == null ? "" : word.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        List<Keyword> before = keywords.getAndUpdate(current -> {
            if (indexOf(current, trimmed) >= 0) {
                return current;
            }
            List<Keyword> next = new ArrayList<>(current);
            next.add(compile(trimmed));
            return List.copyOf(next);
        });
        return indexOf(before, trimmed) < 0;
    }

    public boolean remove(String word) {
        String trimmed = word == null ? "" : word.trim();
        List<Keyword> before = keywords.getAndUpdate(current -> {
            int index = indexOf(current, trimmed);
            if (index < 0) {
                return current;
            }
            List<Keyword> next = new ArrayList<>(current);
            next.remove(index);
            return List.copyOf(next);
        });
        return indexOf(before, trimmed) >= 0;
    }

    public List<String> words() {
        return keywords.get().stream().map(Keyword::word).toList();
    }

    public int size() {
        return keywords.get().size();
    }

    private static int indexOf(List<Keyword> list, String word) {
        String folded = word.toLowerCase(Locale.ROOT);
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).word().toLowerCase(Locale.ROOT).equals(folded)) {
                return i;
            }
        }
        return -1;
    }

    private static Keyword compile(String word) {
        return new Keyword(word, Pattern.compile(
                Pattern.quote(word),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        ));
    }
}
