package com.resurrector.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resurrector.dto.request.AnalysisRequest;
import com.resurrector.dto.response.AnalysisResponse;
import com.resurrector.exception.AnalysisException;
import com.resurrector.exception.ErrorKind;
import com.resurrector.inference.NameFormatter;
import com.resurrector.inference.OperationMapper;
import com.resurrector.inference.PrimaryKeyDetector;
import com.resurrector.inference.ResponseUnwrapper;
import com.resurrector.inference.TypeInferencer;
import com.resurrector.inference.UnwrapResult;
import com.resurrector.model.AnalysisMode;
import com.resurrector.model.AnalysisStage;
import com.resurrector.model.CrudOperation;
import com.resurrector.model.FieldType;
import com.resurrector.model.RawResource;
import com.resurrector.model.ResourceField;
import com.resurrector.model.ResourceSchema;
import com.resurrector.service.api.ResourceAnalyzer;
import com.resurrector.service.api.SchemaNormalizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates one analysis: validate, dispatch to the analyzer registered for the request mode,
 * then run every raw resource through unwrap, inference, key detection, operation mapping and naming.
 */
@Service
@Slf4j
public class SchemaNormalizerImpl implements SchemaNormalizer {

    private static final String FALLBACK_RESOURCE_NAME = "resource";

    private final Map<AnalysisMode, ResourceAnalyzer> analyzers = new EnumMap<>(AnalysisMode.class);

    public SchemaNormalizerImpl(List<ResourceAnalyzer> analyzers) {
        for (ResourceAnalyzer analyzer : analyzers) {
            for (AnalysisMode mode : analyzer.modes()) {
                ResourceAnalyzer previous = this.analyzers.put(mode, analyzer);
                if (previous != null) {
                    throw new IllegalStateException("Mode " + mode.tag() + " is claimed by both "
                            + previous.getClass().getSimpleName() + " and " + analyzer.getClass().getSimpleName());
                }
            }
        }
    }

    @Override
    public AnalysisResponse analyze(AnalysisRequest request) {
        if (request == null) {
            throw AnalysisException.invalidInput("An analysis request is required");
        }
        Run run = new Run();
        try {
            request.validate();
            ResourceAnalyzer analyzer = analyzers.get(request.mode());
            if (analyzer == null) {
                throw new AnalysisException(ErrorKind.INTERNAL, "No analyzer is registered for mode " + request.mode().tag());
            }

            run.enter(AnalysisStage.DISPATCHED);
            log.info("Analyzing {} input with {}", request.mode().tag(), analyzer.getClass().getSimpleName());
            List<RawResource> raw = analyzer.analyze(request);
            if (raw.isEmpty()) {
                throw AnalysisException.noResources("The " + request.mode().tag() + " input describes no resources");
            }

            List<ResourceSchema> resources = new ArrayList<>();
            Set<String> usedNames = new HashSet<>();
            for (RawResource resource : raw) {
                normalize(resource, usedNames, run).ifPresent(resources::add);
            }
            if (resources.isEmpty()) {
                throw AnalysisException.noResources("None of the " + raw.size() + " resource(s) found in the "
                        + request.mode().tag() + " input has any fields");
            }

            run.enter(AnalysisStage.ASSEMBLED);
            log.info("Analysis of {} input produced {} resource(s)", request.mode().tag(), resources.size());
            return new AnalysisResponse(resources);
        } catch (AnalysisException e) {
            log.warn("Analysis failed with {}: {}", e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure during stage {}", run.stage, e);
            throw new AnalysisException(ErrorKind.INTERNAL, "Unexpected " + e.getClass().getSimpleName()
                    + " during stage " + run.stage.name().toLowerCase(Locale.ROOT), e);
        }
    }

    private Optional<ResourceSchema> normalize(RawResource raw, Set<String> usedNames, Run run) {
        run.enter(AnalysisStage.UNWRAPPING);
        UnwrapResult unwrapped = raw.getSamplePayload() == null
                ? UnwrapResult.empty()
                : ResponseUnwrapper.unwrap(raw.getSamplePayload());

        run.enter(AnalysisStage.INFERRING);
        Map<String, FieldType> types = new LinkedHashMap<>(raw.getDeclaredFields());
        Map<String, List<JsonNode>> samples = new LinkedHashMap<>();
        for (ObjectNode row : unwrapped.records()) {
            row.fields().forEachRemaining(field -> {
                if (!field.getKey().isBlank()) {
                    samples.computeIfAbsent(field.getKey(), key -> new ArrayList<>()).add(field.getValue());
                }
            });
        }
        samples.forEach((name, values) -> types.putIfAbsent(name, TypeInferencer.fromValues(values)));
        if (types.isEmpty()) {
            log.debug("Dropping resource '{}': no fields could be inferred", raw.getName());
            return Optional.empty();
        }

        run.enter(AnalysisStage.KEY_DETECTING);
        List<String> fieldNames = List.copyOf(types.keySet());
        String hint = raw.getPrimaryKeyHint();
        String primaryKey = hint != null && types.containsKey(hint)
                ? hint
                : PrimaryKeyDetector.detect(raw.getName(), fieldNames);

        run.enter(AnalysisStage.OPERATION_MAPPING);
        List<CrudOperation> operations = operations(raw, unwrapped.list());

        run.enter(AnalysisStage.NAMING);
        String name = uniqueName(raw.getName(), usedNames);
        List<ResourceField> fields = new ArrayList<>();
        types.forEach((field, type) -> fields.add(new ResourceField(field, type, NameFormatter.format(field))));
        return Optional.of(new ResourceSchema(name, NameFormatter.format(name), raw.getEndpoint(), primaryKey,
                fields, operations));
    }

    /**
     * HTTP evidence wins; SOAP operation names come next, widened by the sample default when the
     * resource came from a captured response; a bare sample gets the sample default alone.
     */
    static List<CrudOperation> operations(RawResource raw, boolean isList) {
        if (!raw.getObservedCalls().isEmpty()) {
            return OperationMapper.fromHttpCalls(raw.getObservedCalls());
        }
        Set<CrudOperation> operations = EnumSet.noneOf(CrudOperation.class);
        if (!raw.getSoapOperations().isEmpty()) {
            operations.addAll(OperationMapper.fromSoapOperations(raw.getSoapOperations()));
        }
        if (raw.isFromSample()) {
            operations.addAll(OperationMapper.sampleDefault(isList));
        }
        return List.copyOf(operations);
    }

    static String uniqueName(String name, Set<String> usedNames) {
        String base = name == null || name.isBlank() ? FALLBACK_RESOURCE_NAME : name.trim().toLowerCase(Locale.ROOT);
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private static final class Run {

        private AnalysisStage stage = AnalysisStage.VALIDATING;

        void enter(AnalysisStage next) {
            stage = next;
            log.debug("Stage {}", next);
        }
    }
}
