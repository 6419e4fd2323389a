package relay.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-destination content filters.
 *
 * <p>A message passes when its sender is not blocked, its text (if any) is at least
 * {@code minLength} characters, contains none of {@code denyWords} and, when
 * {@code allowWords} is non-empty, contains at least one of them. Word matching is
 * case-insensitive substring matching. Media messages without a caption skip the
 * text checks, except that a non-empty allow list still rejects them.
 */
public record MessageFilters(int minLength, List<String> allowWords, List<String> denyWords,
        Set<String> blockedSenderIds) {

    public static final MessageFilters NONE = new MessageFilters(0, List.of(), List.of(), Set.of());

    public MessageFilters {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0");
        }
        allowWords = normalize(allowWords);
        denyWords = normalize(denyWords);
        blockedSenderIds = blockedSenderIds == null ? Set.of() : Set.copyOf(blockedSenderIds);
    }

    public boolean matches(InboundMessage message) {
        if (message.senderId() != null && blockedSenderIds.contains(message.senderId())) {
            return false;
        }
        String text = message.text().orElse(null);
        if (text == null || text.isEmpty()) {
            return allowWords.isEmpty() && (message.media().isPresent() || minLength == 0);
        }
        if (text.length() < minLength) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : denyWords) {
            if (lower.contains(word)) {
                return false;
            }
        }
        if (allowWords.isEmpty()) {
            return true;
        }
        for (String word : allowWords) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(Collection<String> words) {
        if (words == null) {
            return List.of();
        }
        return words.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
