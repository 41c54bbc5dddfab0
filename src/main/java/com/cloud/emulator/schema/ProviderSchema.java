package com.cloud.emulator.schema;

import com.cloud.emulator.core.model.RelationshipKind;

import java.util.Map;

import static com.cloud.emulator.core.model.RelationshipKind.ASSOCIATED_WITH;
import static com.cloud.emulator.core.model.RelationshipKind.ATTACHED_TO;
import static com.cloud.emulator.core.model.RelationshipKind.CONTAINS;
import static com.cloud.emulator.core.model.RelationshipKind.REFERENCES;
import static com.cloud.emulator.schema.Cardinality.MANY_TO_MANY;
import static com.cloud.emulator.schema.Cardinality.MANY_TO_ONE;
import static com.cloud.emulator.schema.Cardinality.ONE_TO_MANY;
import static com.cloud.emulator.schema.Cardinality.ONE_TO_ONE;

/**
 * Relationship table for the emulated provider.
 *
 * <p>Edge direction follows the blocking rules of each kind:</p>
 * <ul>
 *   <li>{@link RelationshipKind#CONTAINS} points from the container to the child,
 *       so a container with children cannot be deleted.</li>
 *   <li>{@link RelationshipKind#ASSOCIATED_WITH}, {@link RelationshipKind#REFERENCES} and
 *       {@link RelationshipKind#ATTACHED_TO} point from the attaching resource to the
 *       resource it uses, so the target cannot be deleted while in use.</li>
 * </ul>
 */
public final class ProviderSchema {

    public static final String EC2 = "ec2";
    public static final String IAM = "iam";
    public static final String RDS = "rds";
    public static final String LAMBDA = "lambda";

    /**
     * Human-readable names of the resource types the schema knows about.
     */
    public static final Map<String, String> RESOURCE_TYPES = Map.ofEntries(
            Map.entry("ec2:vpc", "Amazon VPC"),
            Map.entry("ec2:subnet", "VPC Subnet"),
            Map.entry("ec2:security-group", "Security Group"),
            Map.entry("ec2:instance", "EC2 Instance"),
            Map.entry("ec2:internet-gateway", "Internet Gateway"),
            Map.entry("ec2:nat-gateway", "NAT Gateway"),
            Map.entry("ec2:route-table", "Route Table"),
            Map.entry("ec2:network-acl", "Network ACL"),
            Map.entry("ec2:network-interface", "Network Interface"),
            Map.entry("iam:role", "IAM Role"),
            Map.entry("iam:policy", "IAM Policy"),
            Map.entry("iam:user", "IAM User"),
            Map.entry("iam:group", "IAM Group"),
            Map.entry("iam:access-key", "Access Key"),
            Map.entry("iam:instance-profile", "Instance Profile"),
            Map.entry("rds:db-instance", "RDS DB Instance"),
            Map.entry("rds:db-subnet-group", "DB Subnet Group"),
            Map.entry("rds:db-parameter-group", "DB Parameter Group"),
            Map.entry("rds:option-group", "Option Group"),
            Map.entry("lambda:function", "Lambda Function")
    );

    private ProviderSchema() {
    }

    public static RelationshipSchema create() {
        RelationshipSchema.Builder builder = RelationshipSchema.builder();
        addNetworkRelationships(builder);
        addIdentityRelationships(builder);
        addDatabaseRelationships(builder);
        addFunctionRelationships(builder);
        return builder.build();
    }

    private static void addNetworkRelationships(RelationshipSchema.Builder b) {
        b.relationship(EC2, "vpc", EC2, "subnet", CONTAINS, ONE_TO_MANY,
                "Subnets are contained within VPCs");
        b.relationship(EC2, "vpc", EC2, "security-group", CONTAINS, ONE_TO_MANY,
                "Security groups are contained within VPCs");
        b.relationship(EC2, "vpc", EC2, "route-table", CONTAINS, ONE_TO_MANY,
                "Route tables are contained within VPCs");
        b.relationship(EC2, "vpc", EC2, "network-acl", CONTAINS, ONE_TO_MANY,
                "Network ACLs are contained within VPCs");
        b.relationship(EC2, "subnet", EC2, "network-interface", CONTAINS, ONE_TO_MANY,
                "Network interfaces are created in subnets");
        b.relationship(EC2, "subnet", EC2, "nat-gateway", CONTAINS, ONE_TO_MANY,
                "NAT gateways are created in subnets");
        b.relationship(EC2, "internet-gateway", EC2, "vpc", ATTACHED_TO, ONE_TO_ONE,
                "Internet gateways can be attached to a single VPC");
        b.relationship(EC2, "subnet", EC2, "route-table", ASSOCIATED_WITH, MANY_TO_ONE,
                "A subnet is associated with one route table");
        b.relationship(EC2, "instance", EC2, "subnet", REFERENCES, MANY_TO_ONE,
                "Instances are launched in subnets");
        b.relationship(EC2, "instance", EC2, "security-group", REFERENCES, MANY_TO_MANY,
                "Instances reference security groups for network rules");
        b.relationship(EC2, "network-interface", EC2, "security-group", REFERENCES, MANY_TO_MANY,
                "Network interfaces reference security groups");
        b.relationship(EC2, "instance", IAM, "instance-profile", REFERENCES, MANY_TO_ONE,
                "Instances can be launched with an instance profile");
    }

    private static void addIdentityRelationships(RelationshipSchema.Builder b) {
        b.relationship(IAM, "policy", IAM, "role", ASSOCIATED_WITH, MANY_TO_MANY,
                "Attached managed policies block role deletion");
        b.relationship(IAM, "policy", IAM, "group", ASSOCIATED_WITH, MANY_TO_MANY,
                "Attached managed policies block group deletion");
        b.relationship(IAM, "policy", IAM, "user", ASSOCIATED_WITH, MANY_TO_MANY,
                "Attached managed policies block user deletion");
        b.relationship(IAM, "user", IAM, "group", ASSOCIATED_WITH, MANY_TO_MANY,
                "Group members block group deletion");
        b.relationship(IAM, "instance-profile", IAM, "role", CONTAINS, MANY_TO_ONE,
                "An instance profile holds a single role");
        b.relationship(IAM, "user", IAM, "access-key", CONTAINS, ONE_TO_MANY,
                "Access keys belong to exactly one user");
    }

    private static void addDatabaseRelationships(RelationshipSchema.Builder b) {
        b.relationship(RDS, "db-instance", RDS, "db-subnet-group", REFERENCES, MANY_TO_ONE,
                "DB instances reference a DB subnet group");
        b.relationship(RDS, "db-instance", RDS, "db-parameter-group", REFERENCES, MANY_TO_ONE,
                "DB instances reference a parameter group");
        b.relationship(RDS, "db-instance", RDS, "option-group", REFERENCES, MANY_TO_ONE,
                "DB instances reference an option group");
        b.relationship(RDS, "db-instance", EC2, "security-group", REFERENCES, MANY_TO_MANY,
                "DB instances reference VPC security groups");
        b.relationship(RDS, "db-subnet-group", EC2, "subnet", REFERENCES, MANY_TO_MANY,
                "DB subnet groups reference subnets");
    }

    private static void addFunctionRelationships(RelationshipSchema.Builder b) {
        b.relationship(LAMBDA, "function", IAM, "role", REFERENCES, MANY_TO_ONE,
                "Functions run under a single execution role");
        b.relationship(LAMBDA, "function", EC2, "security-group", REFERENCES, MANY_TO_MANY,
                "VPC-enabled functions reference security groups");
        b.relationship(LAMBDA, "function", EC2, "subnet", REFERENCES, MANY_TO_MANY,
                "VPC-enabled functions reference subnets");
    }
}
