package com.advisorscout.crawl.model;

/**
 * Fields extracted from a single data source on a profile page (one JSON-LD block or the
 * microdata scan). Values are trimmed; blank values are stored as {@code null}.
 */
public record ProfileCandidate(
    String name,
    String phone,
    String phone2,
    String zipCode,
    String city,
    String street,
    String email
) {
    public static final ProfileCandidate EMPTY = new ProfileCandidate(null, null, null, null, null, null, null);

    public ProfileCandidate {
        name = clean(name);
        phone = clean(phone);
        phone2 = clean(phone2);
        zipCode = clean(zipCode);
        city = clean(city);
        street = clean(street);
        email = clean(email);
    }

    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
