package com.vespasync.sync.identity;

import com.vespasync.sync.model.Institution;
import com.vespasync.sync.model.Person;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityResolverTest {

    @Test
    void resolvePerson_shouldMintOnceAndReuseForSameEmail() throws Exception {
        UUID first = UUID.fromString("00000000-0000-0000-0000-000000000001");
        IdentityResolver resolver = new IdentityResolver(ids(first, UUID.randomUUID()));

        PersonResolution created = resolver.resolvePerson("k1", "Student@School.org");
        PersonResolution again = resolver.resolvePerson("k1", "student@school.org ");

        assertEquals(first, created.personId());
        assertTrue(created.minted());
        assertEquals(first, again.personId());
        assertFalse(again.minted());
        assertEquals("student@school.org", again.email());
        assertEquals(1, resolver.minted());
    }

    @Test
    void resolvePerson_shouldBindReissuedExternalIdToExistingPerson() throws Exception {
        UUID stored = UUID.randomUUID();
        IdentityResolver resolver = new IdentityResolver();
        resolver.bootstrap(List.of(), List.of(Person.builder().id(stored).email("a@b.org").externalId("old").build()), Map.of());

        PersonResolution resolution = resolver.resolvePerson("new", "A@B.org");

        assertEquals(stored, resolution.personId());
        assertFalse(resolution.minted());
        assertEquals(stored, resolver.resolve("new").orElseThrow());
        assertEquals(stored, resolver.resolve("old").orElseThrow());
        assertEquals(1, resolver.aliasesBound());
    }

    @Test
    void resolvePerson_shouldReportReboundWhenExternalIdMovesToAnotherEmail() throws Exception {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        IdentityResolver resolver = new IdentityResolver();
        resolver.bootstrap(List.of(), List.of(
                Person.builder().id(alice).email("alice@x.org").externalId("k1").build(),
                Person.builder().id(bob).email("bob@x.org").externalId("k2").build()
        ), Map.of());

        PersonResolution moved = resolver.resolvePerson("k1", "bob@x.org");

        assertEquals(bob, moved.personId());
        assertTrue(moved.rebound());
        assertEquals(bob, resolver.resolve("k1").orElseThrow());
    }

    @Test
    void resolvePerson_shouldRejectUnusableEmail() {
        IdentityResolver resolver = new IdentityResolver();

        MappingException e = assertThrows(MappingException.class, () -> resolver.resolvePerson("k1", "not-an-email"));
        assertEquals("missing_email", e.category());
        assertThrows(MappingException.class, () -> resolver.resolvePerson("k1", null));
    }

    @Test
    void bootstrap_shouldSeedAliasesAndInstitutions() {
        UUID person = UUID.randomUUID();
        UUID institution = UUID.randomUUID();
        IdentityResolver resolver = new IdentityResolver();

        resolver.bootstrap(
                List.of(Institution.builder().id(institution).externalId("i1").name("North Academy").usesCalendarYear(true).build()),
                List.of(Person.builder().id(person).email("p@x.org").externalId("k2").build()),
                Map.of("k1", person)
        );

        assertEquals(person, resolver.resolve("k1").orElseThrow());
        assertEquals(person, resolver.resolve("k2").orElseThrow());
        assertEquals(person, resolver.resolveByEmail("P@X.org").orElseThrow());
        assertEquals(institution, resolver.institutionId("i1"));
        assertTrue(resolver.institution("i1").orElseThrow().usesCalendarYear());
        assertEquals(institution, resolver.institutionByName("  north academy ").orElseThrow().id());
        assertNotEquals(institution, resolver.institutionId("i2"));
        assertTrue(resolver.institution("i2").isEmpty());
    }

    @Test
    void normalizeEmail_shouldUnwrapMarkupAndRejectMalformed() {
        assertEquals("a@b.org", IdentityResolver.normalizeEmail("<a href=\"mailto:A@B.org\">A@B.org</a>"));
        assertEquals("a@b.org", IdentityResolver.normalizeEmail("<span>a@b.org</span>"));
        assertEquals("", IdentityResolver.normalizeEmail("a@@b.org"));
        assertEquals("", IdentityResolver.normalizeEmail("@b.org"));
        assertEquals("", IdentityResolver.normalizeEmail("a b@c.org"));
        assertEquals("", IdentityResolver.normalizeEmail(null));
    }

    private static java.util.function.Supplier<UUID> ids(UUID... values) {
        Deque<UUID> queue = new ArrayDeque<>(List.of(values));
        return queue::poll;
    }
}
