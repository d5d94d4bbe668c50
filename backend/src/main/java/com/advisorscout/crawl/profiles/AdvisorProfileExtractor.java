package com.advisorscout.crawl.profiles;

import com.advisorscout.crawl.model.AdvisorProfile;
import com.advisorscout.crawl.model.ProfileCandidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds an {@link AdvisorProfile} from a profile page. JSON-LD blocks of a contact-bearing
 * schema.org type are merged first, in document order; microdata ({@code itemprop}) only
 * fills the gaps, and only when name or primary phone is still missing.
 */
@Component
public class AdvisorProfileExtractor {
    private static final Logger log = LoggerFactory.getLogger(AdvisorProfileExtractor.class);
    private static final Set<String> PROFILE_TYPES = Set.of(
        "person",
        "financialservice",
        "localbusiness",
        "professionalservice"
    );

    private final ObjectMapper objectMapper;

    public AdvisorProfileExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AdvisorProfile parse(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            return AdvisorProfile.forUrl(sourceUrl);
        }
        return extract(Jsoup.parse(html, sourceUrl), sourceUrl);
    }

    /**
     * Parses a raw page body. With a null {@code charsetName} the encoding is taken from the byte
     * order mark or a {@code <meta charset>} declaration, UTF-8 otherwise.
     */
    public AdvisorProfile parse(byte[] body, String charsetName, String sourceUrl) throws IOException {
        if (body == null || body.length == 0) {
            return AdvisorProfile.forUrl(sourceUrl);
        }
        return extract(Jsoup.parse(new ByteArrayInputStream(body), charsetName, sourceUrl), sourceUrl);
    }

    private AdvisorProfile extract(Document document, String sourceUrl) {
        AdvisorProfile profile = AdvisorProfile.forUrl(sourceUrl);
        for (JsonNode node : structuredDataCandidates(document, sourceUrl)) {
            profile = ProfileMerger.merge(profile, fromStructuredData(node));
        }

        if (profile.name() == null || profile.phone() == null) {
            profile = ProfileMerger.merge(profile, fromMicrodata(document));
        }
        return profile;
    }

    List<JsonNode> structuredDataCandidates(Document document, String sourceUrl) {
        List<JsonNode> candidates = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.text();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", sourceUrl, e.getOriginalMessage());
                continue;
            }
            for (JsonNode item : elements(root)) {
                if (item.isObject() && isProfileType(item.get("@type"))) {
                    candidates.add(item);
                }
            }
        }
        return candidates;
    }

    private boolean isProfileType(JsonNode typeNode) {
        for (JsonNode type : elements(typeNode)) {
            if (type.isTextual() && PROFILE_TYPES.contains(type.asText().trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    ProfileCandidate fromStructuredData(JsonNode node) {
        LinkedHashSet<String> phones = new LinkedHashSet<>();
        for (JsonNode phone : elements(node.get("telephone"))) {
            addIfPresent(phones, scalar(phone));
        }

        String email = null;
        for (JsonNode contact : elements(node.get("contactPoint"))) {
            if (!contact.isObject()) {
                continue;
            }
            addIfPresent(phones, text(contact, "telephone"));
            if (email == null) {
                email = text(contact, "email");
            }
        }
        if (email == null) {
            email = text(node, "email");
        }

        String street = null;
        String zipCode = null;
        String city = null;
        JsonNode address = node.get("address");
        if (address != null && address.isObject()) {
            street = text(address, "streetAddress");
            zipCode = text(address, "postalCode");
            city = text(address, "addressLocality");
        }

        List<String> phoneSlots = new ArrayList<>(phones);
        return new ProfileCandidate(
            text(node, "name"),
            slot(phoneSlots, 0),
            slot(phoneSlots, 1),
            zipCode,
            city,
            street,
            email
        );
    }

    ProfileCandidate fromMicrodata(Document document) {
        LinkedHashSet<String> phones = new LinkedHashSet<>();
        for (Element phoneTag : document.select("[itemprop=telephone]")) {
            addIfPresent(phones, phoneTag.text());
        }
        List<String> phoneSlots = new ArrayList<>(phones);

        return new ProfileCandidate(
            firstText(document, "name"),
            slot(phoneSlots, 0),
            slot(phoneSlots, 1),
            firstText(document, "postalCode"),
            firstText(document, "addressLocality"),
            firstText(document, "streetAddress"),
            mailtoAddress(document)
        );
    }

    private String firstText(Document document, String itemprop) {
        Element element = document.selectFirst("[itemprop=" + itemprop + "]");
        return element == null ? null : element.text();
    }

    private String mailtoAddress(Document document) {
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href").trim();
            if (href.toLowerCase(Locale.ROOT).startsWith("mailto:")) {
                return href.substring(href.indexOf(':') + 1);
            }
        }
        return null;
    }

    // Only two phone slots exist; later numbers are dropped.
    private String slot(List<String> phones, int index) {
        return index < phones.size() ? phones.get(index) : null;
    }

    private void addIfPresent(Set<String> values, String value) {
        String cleaned = ProfileCandidate.clean(value);
        if (cleaned != null) {
            values.add(cleaned);
        }
    }

    private List<JsonNode> elements(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isArray()) {
            List<JsonNode> items = new ArrayList<>(node.size());
            node.forEach(items::add);
            return items;
        }
        return List.of(node);
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        return scalar(node.get(field));
    }

    private String scalar(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber()) {
            return ProfileCandidate.clean(value.asText());
        }
        return null;
    }
}
