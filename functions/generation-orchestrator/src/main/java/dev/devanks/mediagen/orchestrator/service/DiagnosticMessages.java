package dev.devanks.mediagen.orchestrator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.text.MessageFormat;
import java.util.Locale;

/**
 * Localized user-facing text. Falls back to the supplied English pattern when the bundle
 * has no entry or cannot be read, so callers always get a message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiagnosticMessages {

    private final MessageSource messageSource;

    public String text(String key, String englishPattern, Locale locale, Object... args) {
        try {
            return messageSource.getMessage(key, args, englishPattern, locale);
        } catch (RuntimeException e) {
            log.warn("Could not resolve message '{}' for locale {}: {}", key, locale, e.getMessage());
            return MessageFormat.format(englishPattern, args);
        }
    }
}
