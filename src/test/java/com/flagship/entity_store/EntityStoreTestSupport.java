package com.flagship.entity_store;

import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.AppendResult;
import com.flagship.entity_store.entity.ContactMethod;
import com.flagship.entity_store.entity.ContactMethodKind;
import com.flagship.entity_store.entity.EntityEventService;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityType;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.ContactMethodAdded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.ProvenanceRecorded;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Spring context on the in-memory H2 database, emptied before every test, plus
 * builders for the fixtures most tests need.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class EntityStoreTestSupport {

    private static final List<String> TABLES = List.of(
        "processed_events", "outbox_events", "merge_records", "match_candidates", "erasure_log",
        "entity_provenance", "entity_identifiers", "entity_affiliations", "entity_views", "entity_snapshots",
        "entity_events", "entity_sequences");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected EntityEventService entityEventService;

    @BeforeEach
    void cleanDatabase() {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }

    protected EntityRef createContact(String firstName, String lastName) {
        return create(EntityType.CONTACT, Map.of("first_name", firstName, "last_name", lastName));
    }

    protected EntityRef createCompany(String name) {
        return create(EntityType.COMPANY, Map.of("name", name));
    }

    protected EntityRef create(EntityType type, Map<String, String> fields) {
        AppendResult result = entityEventService.create(type, null,
            EntityCreated.builder().fields(fields).build(), "test", null);
        return result.getState().getRef();
    }

    /**
     * A contact created from one source: one provenance record and an email tied to it.
     */
    protected EntityRef createSourcedContact(String firstName, String email, String source) {
        EntityRef ref = EntityRef.contact(UUID.randomUUID());
        UUID provenanceId = UUID.randomUUID();
        entityEventService.create(EntityType.CONTACT, ref.id(), EntityCreated.builder()
            .fields(Map.of("first_name", firstName))
            .provenance(List.of(ProvenanceRecord.builder()
                .id(provenanceId)
                .source(source)
                .sourceId(source + "-" + firstName)
                .build()))
            .contactMethods(List.of(ContactMethod.builder()
                .kind(ContactMethodKind.EMAIL)
                .value(email)
                .provenanceId(provenanceId)
                .build()))
            .build(), "test", null);
        return ref;
    }

    protected AppendResult addIdentifier(EntityRef ref, String type, String value) {
        return entityEventService.addIdentifier(ref, type, value, "test");
    }

    protected AppendResult addEmail(EntityRef ref, String email) {
        return entityEventService.append(ref, EventType.CONTACT_METHOD_ADDED, ContactMethodAdded.builder()
            .contactMethod(ContactMethod.builder().kind(ContactMethodKind.EMAIL).value(email).build())
            .build(), "test", null);
    }

    protected AppendResult affiliate(EntityRef contact, EntityRef company, String role) {
        return entityEventService.append(contact, EventType.AFFILIATION_ADDED, AffiliationAdded.builder()
            .affiliation(Affiliation.builder().organization(company).role(role).build())
            .build(), "test", null);
    }

    protected AppendResult recordProvenance(EntityRef ref, String source, String sourceId) {
        return entityEventService.append(ref, EventType.PROVENANCE_RECORDED, ProvenanceRecorded.builder()
            .record(ProvenanceRecord.builder().source(source).sourceId(sourceId).build())
            .build(), "test", null);
    }

    protected static Identifier identifier(String type, String value) {
        return Identifier.builder().type(type).value(value).build();
    }
}
