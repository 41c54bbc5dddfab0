package com.cloud.emulator.logging;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    private static final ResourceId VPC = ResourceId.of("ec2", "vpc", "vpc-1");
    private static final ResourceId SUBNET = ResourceId.of("ec2", "subnet", "subnet-1");

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forResource should set operation and resourceId in MDC")
    void forResourceSetsMDC() {
        try (LogContext ctx = LogContext.forResource("unregister", VPC)) {
            assertEquals("unregister", MDC.get("operation"));
            assertEquals("ec2:vpc:vpc-1", MDC.get("resourceId"));
        }
    }

    @Test
    @DisplayName("forRelationship should set both endpoints and the kind label in MDC")
    void forRelationshipSetsMDC() {
        try (LogContext ctx = LogContext.forRelationship("add-relationship", VPC, SUBNET, RelationshipKind.CONTAINS)) {
            assertEquals("add-relationship", MDC.get("operation"));
            assertEquals("ec2:vpc:vpc-1", MDC.get("fromResourceId"));
            assertEquals("ec2:subnet:subnet-1", MDC.get("toResourceId"));
            assertEquals("contains", MDC.get("relationshipKind"));
        }
    }

    @Test
    @DisplayName("forServiceCall should set service, action and a correlationId")
    void forServiceCallSetsMDC() {
        try (LogContext ctx = LogContext.forServiceCall("iam", "AttachRolePolicy")) {
            assertEquals("iam", MDC.get("service"));
            assertEquals("AttachRolePolicy", MDC.get("action"));
            assertNotNull(MDC.get("correlationId"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including added keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forResource("register", VPC).with("extra", "value");
        assertEquals("value", MDC.get("extra"));

        ctx.close();

        assertNull(MDC.get("operation"));
        assertNull(MDC.get("resourceId"));
        assertNull(MDC.get("extra"));
    }

    @Test
    @DisplayName("Closing an inner context should keep keys it did not set")
    void nestedContexts() {
        try (LogContext outer = LogContext.forServiceCall("ec2", "DeleteVpc")) {
            try (LogContext inner = LogContext.forResource("unregister", VPC)) {
                assertEquals("DeleteVpc", MDC.get("action"));
            }
            assertEquals("DeleteVpc", MDC.get("action"));
            assertNull(MDC.get("resourceId"));
        }
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique values")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
