package com.flagship.ad_escrow.campaign;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules an ad text must pass before a campaign is created.
 *
 * Length is measured on the trimmed text. Prohibited words match whole words, case-insensitively.
 */
@Component
@Getter
public class AdContentPolicy {

    private static final Pattern LINK = Pattern.compile("https?://", Pattern.CASE_INSENSITIVE);

    private final int minLength;
    private final int maxLength;
    private final int maxLinks;
    private final List<String> prohibitedWords;
    private final Pattern prohibitedPattern;

    public AdContentPolicy(@Value("${campaign.content.min-length:10}") int minLength,
                           @Value("${campaign.content.max-length:1000}") int maxLength,
                           @Value("${campaign.content.max-links:2}") int maxLinks,
                           @Value("${campaign.content.prohibited-words:}") List<String> prohibitedWords) {
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException(
                "campaign.content length bounds are invalid: " + minLength + ".." + maxLength);
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.maxLinks = maxLinks;
        this.prohibitedWords = prohibitedWords.stream()
            .map(String::trim)
            .filter(word -> !word.isEmpty())
            .map(word -> word.toLowerCase(Locale.ROOT))
            .toList();
        this.prohibitedPattern = this.prohibitedWords.isEmpty() ? null : Pattern.compile(
            "\\b(" + String.join("|", this.prohibitedWords.stream().map(Pattern::quote).toList()) + ")\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * @throws IllegalArgumentException naming the first rule the text breaks
     */
    public void check(String adContent) {
        String text = adContent == null ? "" : adContent.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Ad content cannot be empty");
        }
        if (text.length() < minLength) {
            throw new IllegalArgumentException("Ad content must be at least " + minLength + " characters long");
        }
        if (text.length() > maxLength) {
            throw new IllegalArgumentException("Ad content cannot exceed " + maxLength + " characters");
        }
        if (prohibitedPattern != null) {
            Matcher matcher = prohibitedPattern.matcher(text);
            if (matcher.find()) {
                throw new IllegalArgumentException(
                    "Ad content contains prohibited word: '" + matcher.group(1).toLowerCase(Locale.ROOT) + "'");
            }
        }
        long links = LINK.matcher(text).results().count();
        if (links > maxLinks) {
            throw new IllegalArgumentException("Ad content cannot contain more than " + maxLinks + " links");
        }
    }
}
