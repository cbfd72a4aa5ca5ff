package ai.callflow.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One unit of a method's control flow. The variant set is closed; renderers
 * handle every variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FlowStep.Call.class, name = "call"),
        @JsonSubTypes.Type(value = FlowStep.Decision.class, name = "decision"),
        @JsonSubTypes.Type(value = FlowStep.Loop.class, name = "loop"),
        @JsonSubTypes.Type(value = FlowStep.Switch.class, name = "switch"),
        @JsonSubTypes.Type(value = FlowStep.Return.class, name = "return")
})
public sealed interface FlowStep
        permits FlowStep.Call, FlowStep.Decision, FlowStep.Loop, FlowStep.Switch, FlowStep.Return {

    /** Start offset of the originating source node. */
    int offset();

    /** 1-based source line. */
    int line();

    /**
     * A single invocation site. {@code receiver} is the literal receiver text,
     * empty for unqualified calls.
     */
    record Call(String name, boolean external, String receiver, String rawText, int offset, int line)
            implements FlowStep {
        public Call {
            Objects.requireNonNull(name, "name");
            receiver = receiver == null ? "" : receiver;
            rawText = rawText == null ? "" : rawText;
        }

        /** Receiver text up to the first dot, or "" when unqualified. */
        public String serviceName() {
            return Ids.receiverPrefix(receiver);
        }
    }

    record Decision(String label, int offset, int line, List<FlowStep> yesBranch, List<FlowStep> noBranch)
            implements FlowStep {
        public Decision {
            Objects.requireNonNull(label, "label");
            yesBranch = yesBranch == null ? List.of() : List.copyOf(yesBranch);
            noBranch = noBranch == null ? List.of() : List.copyOf(noBranch);
        }
    }

    record Loop(String label, int offset, int line, List<FlowStep> body) implements FlowStep {
        public Loop {
            Objects.requireNonNull(label, "label");
            body = body == null ? List.of() : List.copyOf(body);
        }
    }

    record Switch(String label, int offset, int line, List<SwitchCase> cases) implements FlowStep {
        public Switch {
            Objects.requireNonNull(label, "label");
            cases = cases == null ? List.of() : List.copyOf(cases);
        }
    }

    record Return(String label, int offset, int line) implements FlowStep {
        public Return {
            Objects.requireNonNull(label, "label");
        }
    }

    /** One case group of a switch, labels joined with ", ". */
    record SwitchCase(String label, List<FlowStep> steps) {
        public SwitchCase {
            Objects.requireNonNull(label, "label");
            steps = steps == null ? List.of() : List.copyOf(steps);
        }
    }
}
