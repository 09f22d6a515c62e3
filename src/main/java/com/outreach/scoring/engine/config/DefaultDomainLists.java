package com.outreach.scoring.engine.config;

import java.util.List;

/**
 * Built-in domain lists used when a configuration does not supply its own.
 */
final class DefaultDomainLists {

    static final List<String> FREE = List.of(
            "gmail.com", "googlemail.com", "yahoo.com", "yahoo.it", "yahoo.de", "hotmail.com", "hotmail.it",
            "outlook.com", "live.com", "msn.com", "aol.com", "icloud.com", "me.com", "protonmail.com",
            "mail.com", "gmx.com", "gmx.de", "gmx.net", "web.de", "t-online.de", "libero.it", "virgilio.it",
            "alice.it", "tin.it", "tiscali.it", "orange.fr", "free.fr", "laposte.net", "yandex.ru", "mail.ru");

    static final List<String> DISPOSABLE = List.of(
            "mailinator.com", "10minutemail.com", "guerrillamail.com", "guerrillamail.net", "sharklasers.com",
            "tempmail.com", "temp-mail.org", "throwawaymail.com", "yopmail.com", "trashmail.com",
            "maildrop.cc", "getnada.com", "dispostable.com", "fakeinbox.com");

    static final List<String> SUSPICIOUS = List.of(
            "example.com", "example.org", "test.com", "domain.com", "email.com", "sample.com", "invalid.com");

    static final List<String> CORPORATE = List.of();

    private DefaultDomainLists() {
    }
}
