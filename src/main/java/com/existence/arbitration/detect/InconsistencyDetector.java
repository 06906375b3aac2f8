package com.existence.arbitration.detect;

import com.existence.arbitration.core.model.Binding;
import com.existence.arbitration.core.model.BindingStatus;
import com.existence.arbitration.core.model.EntityState;
import com.existence.arbitration.core.model.Inconsistency;
import com.existence.arbitration.core.model.InconsistencyType;
import com.existence.arbitration.core.model.SuggestedResolution;
import com.existence.arbitration.store.StatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares each binding's canonical status with the existence signals of both projections.
 *
 * <p>Rules, evaluated per binding (tombstones and bindings awaiting arbitration are skipped):</p>
 * <table>
 *   <caption>Detection rules</caption>
 *   <tr><th>Observed</th><th>Type</th><th>Confidence</th><th>Suggestion</th></tr>
 *   <tr><td>element absent, mark absent</td><td>orphaned</td><td>0.95</td><td>soft-delete</td></tr>
 *   <tr><td>element absent</td><td>missing-element</td><td>0.90</td><td>soft-delete</td></tr>
 *   <tr><td>visible, element deleted</td><td>status-mismatch</td><td>0.95</td><td>hide</td></tr>
 *   <tr><td>hidden, element present</td><td>status-mismatch</td><td>0.85</td><td>show</td></tr>
 *   <tr><td>visible, element present, mark deleted</td><td>ghost-binding</td><td>0.80</td><td>hide</td></tr>
 *   <tr><td>visible, element present, mark absent</td><td>missing-mark</td><td>0.70</td><td>soft-delete</td></tr>
 * </table>
 *
 * <p>Mark rules only run when a {@link MarkSignalSource} is configured. Finding a divergence
 * never throws; only unreadable signals do.</p>
 */
public class InconsistencyDetector {
    private static final Logger log = LoggerFactory.getLogger(InconsistencyDetector.class);

    static final double ORPHANED_CONFIDENCE = 0.95;
    static final double MISSING_ELEMENT_CONFIDENCE = 0.90;
    static final double VISIBLE_BUT_DELETED_CONFIDENCE = 0.95;
    static final double HIDDEN_BUT_PRESENT_CONFIDENCE = 0.85;
    static final double GHOST_BINDING_CONFIDENCE = 0.80;
    static final double MISSING_MARK_CONFIDENCE = 0.70;

    private final StatusStore statusStore;
    private final ElementSignalSource elementSignals;
    private final MarkSignalSource markSignals;
    private final Clock clock;

    public InconsistencyDetector(StatusStore statusStore, ElementSignalSource elementSignals) {
        this(statusStore, elementSignals, null, Clock.systemUTC());
    }

    /**
     * @param markSignals projection B signals, or null to evaluate element-side rules only
     */
    public InconsistencyDetector(StatusStore statusStore, ElementSignalSource elementSignals,
                                 MarkSignalSource markSignals, Clock clock) {
        this.statusStore = Objects.requireNonNull(statusStore, "statusStore is required");
        this.elementSignals = Objects.requireNonNull(elementSignals, "elementSignals is required");
        this.markSignals = markSignals;
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Detects divergences for every binding of the scope.
     *
     * @throws SignalUnavailableException if a projection's signals cannot be read
     */
    public List<Inconsistency> detect(String scopeId) {
        List<Binding> bindings = statusStore.findByContainerId(scopeId);
        Map<String, EntityState> elements = readElements(scopeId);
        Map<String, Map<String, EntityState>> marksByDocument = new HashMap<>();
        Instant now = clock.instant();

        List<Inconsistency> findings = new ArrayList<>();
        for (Binding binding : bindings) {
            BindingStatus status = binding.getCurrentStatus();
            if (status == BindingStatus.DELETED || status == BindingStatus.PENDING) {
                continue;
            }
            EntityState element = binding.getLinkedElementId() != null
                    ? elements.getOrDefault(binding.getLinkedElementId(), EntityState.ABSENT)
                    : EntityState.ABSENT;
            Optional<EntityState> mark = markStateOf(binding, marksByDocument);

            evaluate(binding, element, mark, now).ifPresent(findings::add);
        }
        log.info("detect.completed scopeId={} bindings={} inconsistencies={}",
                scopeId, bindings.size(), findings.size());
        return findings;
    }

    private Optional<Inconsistency> evaluate(Binding binding, EntityState element,
                                             Optional<EntityState> mark, Instant now) {
        BindingStatus status = binding.getCurrentStatus();

        if (element == EntityState.ABSENT) {
            if (mark.isPresent() && mark.get() == EntityState.ABSENT) {
                return Optional.of(finding(binding, InconsistencyType.ORPHANED, element, mark,
                        SuggestedResolution.SOFT_DELETE, ORPHANED_CONFIDENCE, now));
            }
            return Optional.of(finding(binding, InconsistencyType.MISSING_ELEMENT, element, mark,
                    SuggestedResolution.SOFT_DELETE, MISSING_ELEMENT_CONFIDENCE, now));
        }
        if (status == BindingStatus.VISIBLE && element == EntityState.DELETED) {
            return Optional.of(finding(binding, InconsistencyType.STATUS_MISMATCH, element, mark,
                    SuggestedResolution.SET_HIDDEN, VISIBLE_BUT_DELETED_CONFIDENCE, now));
        }
        if (status == BindingStatus.HIDDEN && element == EntityState.PRESENT) {
            return Optional.of(finding(binding, InconsistencyType.STATUS_MISMATCH, element, mark,
                    SuggestedResolution.SET_VISIBLE, HIDDEN_BUT_PRESENT_CONFIDENCE, now));
        }
        if (status == BindingStatus.VISIBLE && element == EntityState.PRESENT && mark.isPresent()) {
            if (mark.get() == EntityState.DELETED) {
                return Optional.of(finding(binding, InconsistencyType.GHOST_BINDING, element, mark,
                        SuggestedResolution.SET_HIDDEN, GHOST_BINDING_CONFIDENCE, now));
            }
            if (mark.get() == EntityState.ABSENT) {
                return Optional.of(finding(binding, InconsistencyType.MISSING_MARK, element, mark,
                        SuggestedResolution.SOFT_DELETE, MISSING_MARK_CONFIDENCE, now));
            }
        }
        return Optional.empty();
    }

    private Inconsistency finding(Binding binding, InconsistencyType type, EntityState element,
                                  Optional<EntityState> mark, SuggestedResolution suggestion,
                                  double confidence, Instant now) {
        return Inconsistency.builder()
                .bindingId(binding.getId())
                .type(type)
                .detectedAt(now)
                .bindingStatus(binding.getCurrentStatus())
                .elementDeleted(element == EntityState.ABSENT ? null : element == EntityState.DELETED)
                .markExists(mark.map(m -> m == EntityState.PRESENT).orElse(null))
                .suggestedResolution(suggestion)
                .resolutionConfidence(confidence)
                .snapshot(snapshot(binding, element, mark))
                .build();
    }

    private static Map<String, Object> snapshot(Binding binding, EntityState element, Optional<EntityState> mark) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("bindingId", binding.getId());
        snapshot.put("containerId", binding.getContainerId());
        snapshot.put("status", binding.getCurrentStatus().wireName());
        snapshot.put("version", binding.getVersion());
        snapshot.put("statusUpdatedAt", binding.getStatusUpdatedAt().toString());
        if (binding.getStatusUpdatedBy() != null) {
            snapshot.put("statusUpdatedBy", binding.getStatusUpdatedBy());
        }
        if (binding.getLinkedElementId() != null) {
            snapshot.put("elementId", binding.getLinkedElementId());
        }
        snapshot.put("elementState", element.name().toLowerCase(Locale.ROOT));
        if (binding.getDocumentId() != null) {
            snapshot.put("documentId", binding.getDocumentId());
        }
        if (binding.getMarkKey() != null) {
            snapshot.put("markKey", binding.getMarkKey());
        }
        mark.ifPresent(m -> snapshot.put("markState", m.name().toLowerCase(Locale.ROOT)));
        return snapshot;
    }

    private Map<String, EntityState> readElements(String scopeId) {
        try {
            Map<String, EntityState> states = elementSignals.elementStates(scopeId);
            return states != null ? states : Map.of();
        } catch (Exception e) {
            throw new SignalUnavailableException("Cannot read element signals for scope " + scopeId, e);
        }
    }

    private Optional<EntityState> markStateOf(Binding binding, Map<String, Map<String, EntityState>> cache) {
        if (markSignals == null || binding.getDocumentId() == null || binding.getMarkKey() == null) {
            return Optional.empty();
        }
        Map<String, EntityState> marks = cache.get(binding.getDocumentId());
        if (marks == null) {
            try {
                Map<String, EntityState> read = markSignals.markStates(binding.getDocumentId());
                marks = read != null ? read : Map.of();
            } catch (Exception e) {
                throw new SignalUnavailableException(
                        "Cannot read mark signals for document " + binding.getDocumentId(), e);
            }
            cache.put(binding.getDocumentId(), marks);
        }
        return Optional.of(marks.getOrDefault(binding.getMarkKey(), EntityState.ABSENT));
    }
}
