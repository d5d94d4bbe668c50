package com.advisorscout.crawl.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reconciled contact sheet for one advisor profile page.
 *
 * <p>{@code profileUrl} is fixed at creation. All other fields are trimmed and blank values
 * are stored as {@code null}.
 */
public record AdvisorProfile(
    String name,
    String phone,
    String phone2,
    String zipCode,
    String city,
    String street,
    String email,
    String profileUrl
) {
    public static final List<String> COLUMNS = List.of(
        "Name",
        "Phone",
        "Phone 2",
        "ZIP",
        "City",
        "Street",
        "Email",
        "Profile URL"
    );

    public AdvisorProfile {
        Objects.requireNonNull(profileUrl, "profileUrl");
        name = ProfileCandidate.clean(name);
        phone = ProfileCandidate.clean(phone);
        phone2 = ProfileCandidate.clean(phone2);
        zipCode = ProfileCandidate.clean(zipCode);
        city = ProfileCandidate.clean(city);
        street = ProfileCandidate.clean(street);
        email = ProfileCandidate.clean(email);
    }

    public static AdvisorProfile forUrl(String profileUrl) {
        return new AdvisorProfile(null, null, null, null, null, null, null, profileUrl);
    }

    /** True when at least one of name, phone or email was extracted. */
    public boolean hasContactSignal() {
        return name != null || phone != null || email != null;
    }

    public ProfileCandidate asCandidate() {
        return new ProfileCandidate(name, phone, phone2, zipCode, city, street, email);
    }

    /** Values in {@link #COLUMNS} order. */
    public List<String> toRow() {
        return Arrays.asList(name, phone, phone2, zipCode, city, street, email, profileUrl);
    }
}
