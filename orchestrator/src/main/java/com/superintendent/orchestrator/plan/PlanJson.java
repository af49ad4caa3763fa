package com.superintendent.orchestrator.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.model.WorkflowStep;

import java.util.List;
import java.util.Map;

/**
 * JSON wire format for {@link WorkflowPlan}, used for dry-run output:
 *
 * <pre>
 *   {"steps": [{"id", "action", "params", "depends_on"}, ...], "metadata": {...}}
 * </pre>
 *
 * Step and metadata ordering is preserved, so parse(serialize(plan)) equals plan.
 */
public class PlanJson {

    /** On-the-wire shape; WorkflowPlan itself carries an index that must not be serialized. */
    record PlanDocument(List<WorkflowStep> steps, Map<String, Object> metadata) {}

    private final ObjectMapper json;

    public PlanJson(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public PlanJson() {
        this(new ObjectMapper());
    }

    public String toJson(WorkflowPlan plan) {
        try {
            return json.writer(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(new PlanDocument(plan.getSteps(), plan.getMetadata()));
        } catch (JsonProcessingException e) {
            throw new PlanFormatException("Failed to serialize plan", e);
        }
    }

    public WorkflowPlan fromJson(String body) {
        try {
            PlanDocument doc = json.readValue(body, PlanDocument.class);
            return new WorkflowPlan(doc.steps(), doc.metadata());
        } catch (JsonProcessingException e) {
            throw new PlanFormatException("Failed to parse plan JSON", e);
        }
    }
}
