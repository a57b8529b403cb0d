package com.flagship.entity_store.merge;

import com.flagship.entity_store.EntityStoreTestSupport;
import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.ContactMethod;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.EntityStatus;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.entity.exception.EntityStateException;
import com.flagship.entity_store.event.EventLog;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.projection.ProjectionMaintenanceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MergeCoordinatorTest extends EntityStoreTestSupport {

    @Autowired
    private MergeCoordinator mergeCoordinator;

    @Autowired
    private MatchCandidatePersistenceService persistence;

    @Autowired
    private EventLog eventLog;

    @Autowired
    private ProjectionMaintenanceService maintenanceService;

    private MatchCandidate submit(EntityRef a, EntityRef b, double confidence) {
        return mergeCoordinator.submit(a, b, confidence, Map.of("email", confidence), "matcher");
    }

    private static Set<String> contactValues(EntityState state) {
        return state.getContactMethods().stream().map(ContactMethod::getValue).collect(Collectors.toSet());
    }

    private static Set<String> identifierValues(EntityState state) {
        return state.getIdentifiers().stream().map(Identifier::getValue).collect(Collectors.toSet());
    }

    private static Set<String> sources(EntityState state) {
        return state.getProvenance().stream().map(ProvenanceRecord::getSource).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Merge then split")
    class MergeThenSplit {

        @Test
        @DisplayName("Split hands the absorbed identity's items to a new entity and leaves the survivor's own")
        void mergeAndSplitRoundTrip() {
            EntityRef a = createSourcedContact("Ada", "ada@crm.example", "crm");
            addIdentifier(a, "github", "ada");
            entityEventService.updateFields(a, Map.of("title", "Countess"), null, "test");
            EntityRef b = createSourcedContact("Bea", "bea@mail.example", "gmail");
            addIdentifier(b, "phone", "+44 20 0000 0000");
            assertEquals(3, eventLog.count(a));
            assertEquals(2, eventLog.count(b));

            MatchCandidate candidate = submit(a, b, 0.8);
            assertEquals(MatchStatus.PENDING, candidate.getStatus());

            MergeResult merged = mergeCoordinator.approve(candidate.getId(), null, "reviewer", Map.of());

            EntityState survivor = merged.getSurvivor();
            assertEquals(a, survivor.getRef());
            assertEquals(Set.of("ada@crm.example", "bea@mail.example"), contactValues(survivor));
            assertEquals(Set.of("ada", "+44 20 0000 0000"), identifierValues(survivor));
            assertEquals(Set.of("crm", "gmail"), sources(survivor));
            assertEquals(List.of(b.id()), survivor.getAbsorbedEntityIds());
            assertEquals(4, survivor.getVersion());
            assertEquals("Ada", survivor.getFields().get("first_name"));

            EntityState absorbed = merged.getAbsorbed();
            assertEquals(EntityStatus.MERGED, absorbed.getStatus());
            assertEquals(a.id(), absorbed.getMergedInto());
            assertEquals(3, absorbed.getVersion());
            assertEquals(MatchStatus.APPROVED, merged.getCandidate().getStatus());
            assertEquals(a.id(), merged.getCandidate().getSurvivorId());
            assertEquals(1, merged.getRecord().getContactMethodsTransferred());

            SplitResult split = mergeCoordinator.split(candidate.getId(), "reviewer");

            EntityState restored = split.getSurvivor();
            assertEquals(Set.of("ada@crm.example"), contactValues(restored));
            assertEquals(Set.of("ada"), identifierValues(restored));
            assertEquals(Set.of("crm"), sources(restored));
            assertTrue(restored.getAbsorbedEntityIds().isEmpty());
            assertEquals(5, restored.getVersion());
            assertEquals("Countess", restored.getFields().get("title"));

            EntityState c = split.getSplitEntity();
            assertNotEquals(b, c.getRef());
            assertEquals(EntityStatus.ACTIVE, c.getStatus());
            assertEquals("Bea", c.getFields().get("first_name"));
            assertEquals(Set.of("bea@mail.example"), contactValues(c));
            assertEquals(Set.of("+44 20 0000 0000"), identifierValues(c));
            assertEquals(Set.of("gmail"), sources(c));
            assertEquals(a.id(), c.getSplitFrom());
            assertEquals(1, c.getVersion());

            assertEquals(MatchStatus.REJECTED, split.getCandidate().getStatus());
            assertEquals(c.getRef().id(), split.getRecord().getSplitEntityId());
            assertTrue(persistence.findActiveMergeRecord(candidate.getId()).isEmpty());
            assertEquals(EntityStatus.MERGED, entityEventService.getState(b).getStatus());

            List<String> survivorHistory = eventLog.readAll(a).stream().map(StoredEvent::getEventType).toList();
            assertEquals(List.of("Created", "IdentifierAdded", "Updated", "Merged", "Split"), survivorHistory);
            assertFalse(maintenanceService.verify(a).isDiverged());
            assertFalse(maintenanceService.verify(b).isDiverged());
            assertFalse(maintenanceService.verify(c.getRef()).isDiverged());
        }

        @Test
        @DisplayName("Splitting a merge chain releases everything that came in through the absorbed identity")
        void splitReleasesChain() {
            EntityRef a = createSourcedContact("Ada", "ada@crm.example", "crm");
            EntityRef b = createSourcedContact("Bea", "bea@mail.example", "gmail");
            EntityRef d = createSourcedContact("Dot", "dot@old.example", "legacy");

            MatchCandidate bAndD = submit(b, d, 0.7);
            mergeCoordinator.approve(bAndD.getId(), b.id(), "reviewer", Map.of());
            MatchCandidate aAndB = submit(a, b, 0.7);
            MergeResult merged = mergeCoordinator.approve(aAndB.getId(), a.id(), "reviewer", Map.of());
            assertEquals(Set.of("ada@crm.example", "bea@mail.example", "dot@old.example"),
                contactValues(merged.getSurvivor()));

            SplitResult split = mergeCoordinator.split(aAndB.getId(), "reviewer");

            assertEquals(Set.of("ada@crm.example"), contactValues(split.getSurvivor()));
            assertEquals(Set.of("crm"), sources(split.getSurvivor()));
            assertEquals(Set.of("bea@mail.example", "dot@old.example"), contactValues(split.getSplitEntity()));
            assertEquals(Set.of("gmail", "legacy"), sources(split.getSplitEntity()));
            assertTrue(split.getSurvivor().getAbsorbedEntityIds().isEmpty());
        }

        @Test
        @DisplayName("Items added to the survivor after the merge stay with it")
        void postMergeItemsStay() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            MatchCandidate candidate = submit(a, b, 0.6);
            mergeCoordinator.approve(candidate.getId(), a.id(), "reviewer", Map.of("last_name", "King"));
            addEmail(a, "ada@later.example");

            SplitResult split = mergeCoordinator.split(candidate.getId(), "reviewer");

            assertEquals(Set.of("ada@later.example"), contactValues(split.getSurvivor()));
            assertEquals("King", split.getSurvivor().getFields().get("last_name"));
            assertEquals("Byron", split.getSplitEntity().getFields().get("last_name"));
        }

        @Test
        @DisplayName("A merge can be split once")
        void splitTwice() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            MatchCandidate candidate = submit(a, b, 0.6);
            mergeCoordinator.approve(candidate.getId(), null, "reviewer", Map.of());
            mergeCoordinator.split(candidate.getId(), "reviewer");

            assertThrows(IllegalStateException.class, () -> mergeCoordinator.split(candidate.getId(), "reviewer"));
        }

        @Test
        @DisplayName("A survivor that was itself merged away cannot be split")
        void survivorNoLongerActive() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            EntityRef e = createContact("Eve", "Other");
            MatchCandidate first = submit(a, b, 0.6);
            mergeCoordinator.approve(first.getId(), a.id(), "reviewer", Map.of());
            MatchCandidate second = submit(e, a, 0.6);
            mergeCoordinator.approve(second.getId(), e.id(), "reviewer", Map.of());

            assertThrows(EntityStateException.class, () -> mergeCoordinator.split(first.getId(), "reviewer"));
        }
    }

    @Nested
    @DisplayName("Repeated merges")
    class RepeatedMerges {

        @Test
        @DisplayName("An entity recreated by a split can be merged and split off again")
        void splitEntityMergedAndSplitAgain() {
            EntityRef a = createSourcedContact("Ada", "ada@crm.example", "crm");
            EntityRef b = createSourcedContact("Bea", "bea@mail.example", "gmail");
            MatchCandidate first = submit(a, b, 0.7);
            mergeCoordinator.approve(first.getId(), a.id(), "reviewer", Map.of());
            EntityRef c = mergeCoordinator.split(first.getId(), "reviewer").getSplitEntity().getRef();
            EntityRef d = createSourcedContact("Dot", "dot@old.example", "legacy");

            MatchCandidate second = submit(c, d, 0.7);
            MergeResult merged = mergeCoordinator.approve(second.getId(), d.id(), "reviewer", Map.of());
            assertEquals(Set.of("bea@mail.example", "dot@old.example"), contactValues(merged.getSurvivor()));

            SplitResult split = mergeCoordinator.split(second.getId(), "reviewer");

            assertEquals(Set.of("dot@old.example"), contactValues(split.getSurvivor()));
            assertEquals(Set.of("legacy"), sources(split.getSurvivor()));
            assertEquals(Set.of("bea@mail.example"), contactValues(split.getSplitEntity()));
            assertEquals(Set.of("gmail"), sources(split.getSplitEntity()));
            assertEquals("Bea", split.getSplitEntity().getFields().get("first_name"));
            assertTrue(split.getSplitEntity().getContactMethods().stream()
                .allMatch(method -> method.getOriginEntityId().equals(split.getSplitEntity().getRef().id())));
            assertFalse(maintenanceService.verify(d).isDiverged());
            assertFalse(maintenanceService.verify(split.getSplitEntity().getRef()).isDiverged());
        }

        @Test
        @DisplayName("An identifier both sides hold is kept once and handed back on split")
        void duplicateIdentifiers() {
            EntityRef a = createContact("Ada", "Lovelace");
            addIdentifier(a, "github", "ada");
            EntityRef b = createContact("Ada", "King");
            addIdentifier(b, "GitHub", "Ada");
            addIdentifier(b, "phone", "+44 20 0000 0000");
            MatchCandidate candidate = submit(a, b, 0.7);

            MergeResult merged = mergeCoordinator.approve(candidate.getId(), a.id(), "reviewer", Map.of());

            assertEquals(2, merged.getSurvivor().getIdentifiers().size());
            assertEquals(Set.of("ada", "+44 20 0000 0000"), identifierValues(merged.getSurvivor()));
            assertEquals(1, merged.getRecord().getIdentifiersTransferred());

            SplitResult split = mergeCoordinator.split(candidate.getId(), "reviewer");

            assertEquals(Set.of("ada"), identifierValues(split.getSurvivor()));
            assertEquals(Set.of("Ada", "+44 20 0000 0000"), identifierValues(split.getSplitEntity()));
            assertFalse(maintenanceService.verify(split.getSplitEntity().getRef()).isDiverged());
        }
    }

    @Nested
    @DisplayName("Company merges")
    class CompanyMerges {

        private EntityRef organizationOf(EntityRef contact) {
            List<Affiliation> affiliations = entityEventService.getState(contact).getAffiliations();
            assertEquals(1, affiliations.size());
            return affiliations.get(0).getOrganization();
        }

        @Test
        @DisplayName("Contacts affiliated with the absorbed company follow it to the survivor and back on split")
        void affiliationsFollowCompany() {
            EntityRef acme = createCompany("Acme");
            EntityRef acmeInc = createCompany("Acme Inc");
            EntityRef ada = createContact("Ada", "Lovelace");
            EntityRef bea = createContact("Bea", "Byron");
            affiliate(ada, acmeInc, "engineer");
            affiliate(bea, acme, "director");
            MatchCandidate candidate = submit(acme, acmeInc, 0.7);

            MergeResult merged = mergeCoordinator.approve(candidate.getId(), acme.id(), "reviewer", Map.of());

            assertEquals(acme, organizationOf(ada));
            assertEquals(acme, organizationOf(bea));
            assertEquals(1, merged.getRecord().getRepointedAffiliationIds().size());
            List<String> history = eventLog.readAll(ada).stream().map(StoredEvent::getEventType).toList();
            assertEquals(List.of("Created", "AffiliationAdded", "AffiliationsRepointed"), history);
            assertFalse(maintenanceService.verify(ada).isDiverged());

            SplitResult split = mergeCoordinator.split(candidate.getId(), "reviewer");

            assertEquals(split.getSplitEntity().getRef(), organizationOf(ada));
            assertEquals(acme, organizationOf(bea));
            assertEquals("Acme Inc", split.getSplitEntity().getFields().get("name"));
            assertEquals(4, eventLog.count(ada));
            assertFalse(maintenanceService.verify(ada).isDiverged());
        }

        @Test
        @DisplayName("Affiliations made with the survivor after the merge stay with it on split")
        void laterAffiliationsStay() {
            EntityRef acme = createCompany("Acme");
            EntityRef acmeInc = createCompany("Acme Inc");
            MatchCandidate candidate = submit(acme, acmeInc, 0.7);
            mergeCoordinator.approve(candidate.getId(), acme.id(), "reviewer", Map.of());
            EntityRef ada = createContact("Ada", "Lovelace");
            affiliate(ada, acme, "engineer");

            mergeCoordinator.split(candidate.getId(), "reviewer");

            assertEquals(acme, organizationOf(ada));
            assertEquals(2, eventLog.count(ada));
        }
    }

    @Nested
    @DisplayName("Review queue")
    class ReviewQueue {

        @Test
        @DisplayName("High-confidence candidates merge automatically with the older entity surviving")
        void autoMerge() {
            EntityRef older = createContact("Ada", "Lovelace");
            EntityRef newer = createContact("Ada", "L.");

            MatchCandidate candidate = submit(newer, older, 0.97);

            assertEquals(MatchStatus.AUTO_MERGED, candidate.getStatus());
            assertEquals(older.id(), candidate.getSurvivorId());
            assertEquals(MergeCoordinator.SYSTEM_ACTOR, candidate.getReviewedBy());
            assertEquals(EntityStatus.MERGED, entityEventService.getState(newer).getStatus());
        }

        @Test
        @DisplayName("A pair with a pending candidate returns it instead of queuing another")
        void duplicateSubmission() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");

            MatchCandidate first = submit(a, b, 0.5);
            MatchCandidate again = submit(b, a, 0.6);

            assertEquals(first.getId(), again.getId());
            assertEquals(1, mergeCoordinator.listCandidates(MatchStatus.PENDING).size());
        }

        @Test
        @DisplayName("Rejecting leaves both entities untouched")
        void reject() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            MatchCandidate candidate = submit(a, b, 0.5);

            MatchCandidate rejected = mergeCoordinator.reject(candidate.getId(), "reviewer", "different people");

            assertEquals(MatchStatus.REJECTED, rejected.getStatus());
            assertEquals("different people", rejected.getReviewNotes());
            assertEquals(1, eventLog.count(a));
            assertEquals(1, eventLog.count(b));
            assertThrows(IllegalStateException.class,
                () -> mergeCoordinator.approve(candidate.getId(), null, "reviewer", Map.of()));
            assertThrows(IllegalStateException.class, () -> mergeCoordinator.split(candidate.getId(), "reviewer"));
        }

        @Test
        @DisplayName("Preview lists conflicting fields and combined counts")
        void preview() {
            EntityRef a = createSourcedContact("Ada", "ada@crm.example", "crm");
            EntityRef b = createSourcedContact("Adah", "adah@mail.example", "gmail");
            addIdentifier(b, "github", "adah");
            MatchCandidate candidate = submit(a, b, 0.5);

            MergePreview preview = mergeCoordinator.preview(candidate.getId());

            assertEquals(Map.of("first_name", List.of("Ada", "Adah")), preview.getConflictingFields());
            assertEquals(1, preview.getCountsB().get("identifiers"));
            assertEquals(2, preview.getCombined().get("contact_methods"));
            assertEquals(2, preview.getCombined().get("provenance"));
            assertEquals(1, eventLog.count(a));
        }

        @Test
        @DisplayName("Deleted or unknown participants are refused")
        void inactiveParticipants() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            EntityRef company = createCompany("Acme");
            MatchCandidate candidate = submit(a, b, 0.5);
            entityEventService.delete(b, "gone", "test");

            assertThrows(EntityStateException.class, () -> submit(a, b, 0.5));
            assertThrows(EntityNotFoundException.class, () -> submit(a, EntityRef.contact(UUID.randomUUID()), 0.5));
            assertThrows(IllegalArgumentException.class, () -> submit(a, company, 0.5));
            assertThrows(EntityStateException.class,
                () -> mergeCoordinator.approve(candidate.getId(), null, "reviewer", Map.of()));
            assertEquals(MatchStatus.PENDING, mergeCoordinator.getCandidate(candidate.getId()).getStatus());
        }

        @Test
        @DisplayName("A survivor outside the pair is rejected and nothing is written")
        void foreignSurvivor() {
            EntityRef a = createContact("Ada", "Lovelace");
            EntityRef b = createContact("Bea", "Byron");
            MatchCandidate candidate = submit(a, b, 0.5);

            assertThrows(IllegalArgumentException.class,
                () -> mergeCoordinator.approve(candidate.getId(), UUID.randomUUID(), "reviewer", Map.of()));
            assertEquals(MatchStatus.PENDING, mergeCoordinator.getCandidate(candidate.getId()).getStatus());
            assertEquals(1, eventLog.count(a));
        }
    }
}
