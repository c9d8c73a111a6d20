package com.vespasync.sync.identity;

import com.vespasync.sync.model.Institution;
import com.vespasync.sync.model.Person;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-run identity maps: external id to internal id, and normalized email to internal id.
 * <p>
 * Email is the natural key of a person. A re-issued external id that arrives with a known
 * email is bound as an alias of the existing internal id, so downstream rows keep pointing
 * at the same person. Not thread-safe; owned by the pipeline driver thread.
 */
public final class IdentityResolver {
    private static final Pattern MAILTO = Pattern.compile("mailto:([^\"'>\\s]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

    private final Map<String, UUID> personByExternalId = new HashMap<>();
    private final Map<String, UUID> personByEmail = new HashMap<>();
    private final Map<String, InstitutionRef> institutionByExternalId = new HashMap<>();
    private final Map<String, InstitutionRef> institutionByName = new HashMap<>();
    private final Supplier<UUID> idFactory;
    private int aliasesBound;
    private int minted;

    public IdentityResolver() {
        this(UUID::randomUUID);
    }

    public IdentityResolver(Supplier<UUID> idFactory) {
        this.idFactory = idFactory;
    }

    /**
     * Seeds the maps from previously stored rows so repeated runs reuse internal ids.
     */
    public void bootstrap(Collection<Institution> institutions, Collection<Person> persons, Map<String, UUID> aliases) {
        if (institutions != null) {
            for (Institution institution : institutions) {
                registerInstitution(institution);
            }
        }
        if (persons != null) {
            for (Person person : persons) {
                String email = normalizeEmail(person.getEmail());
                if (person.getId() == null || email.isEmpty()) {
                    continue;
                }
                personByEmail.put(email, person.getId());
                if (person.getExternalId() != null && !person.getExternalId().isBlank()) {
                    personByExternalId.put(person.getExternalId().trim(), person.getId());
                }
            }
        }
        if (aliases != null) {
            for (Map.Entry<String, UUID> alias : aliases.entrySet()) {
                if (alias.getKey() != null && alias.getValue() != null) {
                    personByExternalId.put(alias.getKey().trim(), alias.getValue());
                }
            }
        }
    }

    public InstitutionRef registerInstitution(Institution institution) {
        InstitutionRef ref = new InstitutionRef(
                institution.getId(),
                institution.getExternalId(),
                institution.getName(),
                institution.isUsesCalendarYear()
        );
        institutionByExternalId.put(institution.getExternalId(), ref);
        if (institution.getName() != null && !institution.getName().isBlank()) {
            institutionByName.put(nameKey(institution.getName()), ref);
        }
        return ref;
    }

    /**
     * Internal id for an institution, reusing the stored one when known.
     */
    public UUID institutionId(String externalId) {
        InstitutionRef existing = institutionByExternalId.get(externalId);
        return existing != null ? existing.id() : idFactory.get();
    }

    public Optional<InstitutionRef> institution(String externalId) {
        if (externalId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(institutionByExternalId.get(externalId.trim()));
    }

    public Optional<InstitutionRef> institutionByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(institutionByName.get(nameKey(name)));
    }

    /**
     * Resolves a person by email first. A known email binds {@code externalId} as an alias;
     * an unknown email mints a new internal id registered under both keys.
     *
     * @throws MappingException when the email is missing or malformed
     */
    public PersonResolution resolvePerson(String externalId, String email) throws MappingException {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty()) {
            throw new MappingException("missing_email", "no usable email for external id " + externalId);
        }
        String ext = externalId == null ? "" : externalId.trim();
        UUID previous = ext.isEmpty() ? null : personByExternalId.get(ext);

        UUID known = personByEmail.get(normalized);
        if (known != null) {
            if (!ext.isEmpty() && !known.equals(previous)) {
                personByExternalId.put(ext, known);
                aliasesBound++;
            }
            return new PersonResolution(known, normalized, false, previous != null && !known.equals(previous));
        }

        UUID id = idFactory.get();
        personByEmail.put(normalized, id);
        if (!ext.isEmpty()) {
            personByExternalId.put(ext, id);
        }
        minted++;
        return new PersonResolution(id, normalized, true, previous != null);
    }

    public Optional<UUID> resolve(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(personByExternalId.get(externalId.trim()));
    }

    public Optional<UUID> resolveByEmail(String email) {
        return Optional.ofNullable(personByEmail.get(normalizeEmail(email)));
    }

    public int personCount() {
        return personByEmail.size();
    }

    public int institutionCount() {
        return institutionByExternalId.size();
    }

    public int aliasesBound() {
        return aliasesBound;
    }

    public int minted() {
        return minted;
    }

    /**
     * Trims, lower-cases and unwraps {@code <a href="mailto:...">} markup. Returns "" when the
     * result does not look like an address.
     */
    public static String normalizeEmail(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        Matcher mailto = MAILTO.matcher(text);
        if (mailto.find()) {
            text = mailto.group(1);
        } else if (text.contains("<")) {
            text = HTML_TAG.matcher(text).replaceAll("");
        }
        text = text.trim().toLowerCase(Locale.ROOT);
        int at = text.indexOf('@');
        if (at <= 0 || at == text.length() - 1 || text.indexOf('@', at + 1) >= 0 || text.contains(" ")) {
            return "";
        }
        return text;
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
