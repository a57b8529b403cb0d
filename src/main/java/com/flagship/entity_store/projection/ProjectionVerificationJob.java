package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.EntityRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sampling of the fold invariant. Diverged rows are reported, and rebuilt
 * when repair is enabled.
 */
@Component
@ConditionalOnProperty(name = "entity-store.verification.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ProjectionVerificationJob {

    private final MaterializedViewStore viewStore;
    private final ProjectionMaintenanceService maintenanceService;

    @Value("${entity-store.verification.sample-size:25}")
    private int sampleSize;

    @Value("${entity-store.verification.repair:false}")
    private boolean repair;

    @Scheduled(fixedDelayString = "${entity-store.verification.interval-ms:300000}")
    public void verifySample() {
        int diverged = 0;
        for (EntityRef ref : viewStore.sample(sampleSize)) {
            try {
                DivergenceReport report = maintenanceService.verify(ref);
                if (report.isDiverged()) {
                    diverged++;
                    if (repair) {
                        maintenanceService.rebuild(ref);
                    }
                }
            } catch (Exception e) {
                log.error("Verification of {} failed: {}", ref, e.getMessage());
            }
        }
        if (diverged > 0) {
            log.warn("Verification run found {} diverged rows (repair={})", diverged, repair);
        } else {
            log.debug("Verification run found no divergence");
        }
    }
}
