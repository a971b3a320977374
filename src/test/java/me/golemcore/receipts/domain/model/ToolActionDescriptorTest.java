package me.golemcore.receipts.domain.model;

import me.golemcore.receipts.testsupport.TestDescriptors;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolActionDescriptorTest {

    @Test
    void rejectsRiskOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> TestDescriptors.updateLead().riskLevel(0).build());
        assertThrows(IllegalArgumentException.class, () -> TestDescriptors.updateLead().riskLevel(11).build());
        assertEquals(10, TestDescriptors.updateLead().riskLevel(10).build().riskLevel());
    }

    @Test
    void requiresIdentityAndContext() {
        assertThrows(NullPointerException.class, () -> TestDescriptors.updateLead().toolName(null).build());
        assertThrows(NullPointerException.class, () -> TestDescriptors.updateLead().actionType(null).build());
        assertThrows(NullPointerException.class, () -> TestDescriptors.updateLead().businessContext(null).build());
    }

    @Test
    void appliesDefaults() {
        ToolActionDescriptor descriptor = TestDescriptors.updateLead()
                .toolCategory(null)
                .dataClassification(null)
                .complianceRequirements(null)
                .parameters(null)
                .build();

        assertEquals(ToolCategory.OTHER, descriptor.toolCategory());
        assertEquals(DataClassification.INTERNAL, descriptor.dataClassification());
        assertEquals(List.of(), descriptor.complianceRequirements());
        assertTrue(descriptor.parameters().isEmpty());
    }

    @Test
    void isImmutableOnceBuilt() {
        Map<String, Object> params = new HashMap<>();
        params.put("leadId", "L-1");
        ToolActionDescriptor descriptor = TestDescriptors.updateLead().parameters(params).build();

        params.put("leadId", "L-2");

        assertEquals("L-1", descriptor.parameters().get("leadId"));
        assertThrows(UnsupportedOperationException.class, () -> descriptor.parameters().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> descriptor.complianceRequirements().add("HIPAA"));
    }

    @Test
    void businessValueMustBeNormalized() {
        assertThrows(IllegalArgumentException.class, () -> TestDescriptors.salesContext(1.5, CustomerImpact.LOW));
        assertThrows(IllegalArgumentException.class, () -> TestDescriptors.salesContext(-0.1, CustomerImpact.LOW));
        assertEquals(0.0, TestDescriptors.salesContext(0.0, CustomerImpact.LOW).businessValue());
    }
}
