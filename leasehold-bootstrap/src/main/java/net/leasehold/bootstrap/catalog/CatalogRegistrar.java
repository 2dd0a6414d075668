package net.leasehold.bootstrap.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.leasehold.bootstrap.props.LeaseholdProperties;
import net.leasehold.core.error.ConfigurationException;
import net.leasehold.core.model.JobDefinition;
import net.leasehold.core.model.ScheduledJob;
import net.leasehold.core.service.SchedulerAdminService;
import net.leasehold.integration.spring.cron.SchedulePresets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** 설정의 catalog.jobs 를 이름 기준으로 생성/수정한다. 설정에 없는 잡은 건드리지 않는다. */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    static final String CREATED_BY = "catalog";

    private final SchedulerAdminService admin;
    private final ObjectMapper mapper;

    public CatalogRegistrar(SchedulerAdminService admin, ObjectMapper mapper) {
        this.admin = admin;
        this.mapper = mapper;
    }

    public int register(LeaseholdProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getJobs()) {
            upsert(def);
            n++;
        }
        log.info("catalog registered: {} job(s)", n);
        return n;
    }

    private void upsert(LeaseholdProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getKind() == null || def.getSchedule() == null) {
            throw new ConfigurationException("catalog job requires name, kind and schedule: " + def);
        }
        Optional<ScheduledJob> existing = admin.findJobByName(def.getName());
        JobDefinition jd = toDefinition(def, existing);
        String schedule = SchedulePresets.describe(def.getSchedule()).orElse(def.getSchedule());

        if (existing.isPresent()) {
            ScheduledJob job = admin.updateJob(existing.get().id(), jd);
            log.info("catalog job updated: '{}' (id={}, schedule={}, enabled={})",
                    job.name(), job.id(), schedule, job.enabled());
        } else {
            ScheduledJob job = admin.createJob(jd);
            log.info("catalog job created: '{}' (id={}, schedule={})", job.name(), job.id(), schedule);
        }
    }

    /** enabled 를 명시하지 않은 항목은 기존 잡의 일시정지 상태를 덮어쓰지 않는다 */
    JobDefinition toDefinition(LeaseholdProperties.JobDef def, Optional<ScheduledJob> existing) {
        boolean enabled = def.getEnabled() != null
                ? def.getEnabled()
                : existing.map(ScheduledJob::enabled).orElse(true);
        return toDefinition(def).withEnabled(enabled);
    }

    JobDefinition toDefinition(LeaseholdProperties.JobDef def) {
        JsonNode params = def.getParameters() == null || def.getParameters().isEmpty()
                ? null
                : mapper.valueToTree(def.getParameters());
        return JobDefinition.of(def.getName(), def.getKind(), def.getSchedule(), CREATED_BY)
                .withDescription(def.getDescription())
                .withParameters(params)
                .withPriority(def.getPriority())
                .withMaxRetries(def.getMaxRetries())
                .withTimeout(def.getTimeout())
                .withTags(def.getTags())
                .withMetadata(def.getMetadata())
                .withEnabled(def.getEnabled() == null || def.getEnabled());
    }
}
