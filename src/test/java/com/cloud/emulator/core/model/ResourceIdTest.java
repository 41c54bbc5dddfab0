package com.cloud.emulator.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResourceId Tests")
class ResourceIdTest {

    @Test
    @DisplayName("toString should join service, type and id with colons")
    void toStringFormat() {
        assertEquals("ec2:vpc:vpc-1", ResourceId.of("ec2", "vpc", "vpc-1").toString());
    }

    @Test
    @DisplayName("typeKey should omit the id")
    void typeKey() {
        assertEquals("iam:role", ResourceId.of("iam", "role", "admin").typeKey());
    }

    @Test
    @DisplayName("Identities with equal parts should be equal")
    void valueEquality() {
        ResourceId a = ResourceId.of("ec2", "subnet", "subnet-1");
        ResourceId b = new ResourceId("ec2", "subnet", "subnet-1");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, ResourceId.of("ec2", "subnet", "subnet-2"));
    }

    @Test
    @DisplayName("Null or blank parts should be rejected")
    void rejectsMissingParts() {
        assertThrows(NullPointerException.class, () -> ResourceId.of(null, "vpc", "vpc-1"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("ec2", " ", "vpc-1"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of("ec2", "vpc", ""));
    }

    @Test
    @DisplayName("Node should copy its metadata and expose the default flag")
    void nodeMetadata() {
        Node node = new Node(ResourceId.of("ec2", "vpc", "vpc-default"), Map.of(Node.DEFAULT_FLAG, "true"));
        assertTrue(node.isDefault());
        assertThrows(UnsupportedOperationException.class, () -> node.getMetadata().put("k", "v"));
        assertFalse(new Node(ResourceId.of("ec2", "vpc", "vpc-1"), Map.of()).isDefault());
    }

    @Test
    @DisplayName("Edge toString should show the relationship label")
    void edgeToString() {
        Edge edge = new Edge(ResourceId.of("ec2", "vpc", "vpc-1"), ResourceId.of("ec2", "subnet", "subnet-1"),
                RelationshipKind.CONTAINS);
        assertEquals("ec2:vpc:vpc-1 -[contains]-> ec2:subnet:subnet-1", edge.toString());
    }
}
