package com.walkerbrain.portal.modules.auth.application;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class EmailDomainPolicy {

    private final Set<String> allowedDomains;

    public EmailDomainPolicy(@Value("${app.auth.allowed-email-domains:walkeradvertising.com}") String allowedDomains) {
        this.allowedDomains = Arrays.stream(allowedDomains.split(","))
                .map(String::trim)
                .filter(domain -> !domain.isEmpty())
                .map(domain -> domain.startsWith("@") ? domain.substring(1) : domain)
                .map(domain -> domain.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isAllowed(String normalizedEmail) {
        int at = normalizedEmail.lastIndexOf('@');
        if (at <= 0 || at == normalizedEmail.length() - 1) {
            return false;
        }
        return allowedDomains.contains(normalizedEmail.substring(at + 1));
    }

    public Set<String> allowedDomains() {
        return allowedDomains;
    }
}
