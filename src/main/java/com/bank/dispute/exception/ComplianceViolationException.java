package com.bank.dispute.exception;

import com.bank.dispute.model.PatternKind;

import java.util.List;
import java.util.Map;

public class ComplianceViolationException extends DisputeWorkflowException {

    private final String field;
    private final List<PatternKind> kinds;

    public ComplianceViolationException(String disputeId, String field, List<PatternKind> kinds) {
        super(ErrorCode.COMPLIANCE_VIOLATION, disputeId,
                "Rejected " + field + ": " + String.join(", ", categories(kinds)));
        this.field = field;
        this.kinds = List.copyOf(kinds);
    }

    public String getField() {
        return field;
    }

    public List<PatternKind> getKinds() {
        return kinds;
    }

    public List<String> getCategories() {
        return categories(kinds);
    }

    @Override
    public Object getDetails() {
        return Map.of("field", field, "categories", getCategories());
    }

    private static List<String> categories(List<PatternKind> kinds) {
        return kinds.stream().map(PatternKind::getCategory).toList();
    }
}
