package com.cloud.emulator.manager;

import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Seeds the provider-default network: a default VPC containing a default subnet,
 * network ACL, route table and security group. All of them carry
 * {@code default=true} metadata.
 */
public class DefaultNetworkTopology implements TopologySeed {
    private static final Logger log = LoggerFactory.getLogger(DefaultNetworkTopology.class);

    public static final ResourceId DEFAULT_VPC = ResourceId.of("ec2", "vpc", "vpc-default");
    public static final ResourceId DEFAULT_SUBNET = ResourceId.of("ec2", "subnet", "subnet-default");
    public static final ResourceId DEFAULT_NETWORK_ACL = ResourceId.of("ec2", "network-acl", "acl-default");
    public static final ResourceId DEFAULT_ROUTE_TABLE = ResourceId.of("ec2", "route-table", "rtb-default");
    public static final ResourceId DEFAULT_SECURITY_GROUP = ResourceId.of("ec2", "security-group", "sg-default");

    /**
     * Resources contained by the default VPC, in registration order.
     */
    public static final List<ResourceId> DEFAULT_VPC_CHILDREN = List.of(
            DEFAULT_SUBNET, DEFAULT_NETWORK_ACL, DEFAULT_ROUTE_TABLE, DEFAULT_SECURITY_GROUP);

    @Override
    public void seed(ResourceManager manager) {
        manager.registerResource(DEFAULT_VPC, Map.of(
                Node.DEFAULT_FLAG, "true",
                "cidrBlock", "172.31.0.0/16"));
        for (ResourceId child : DEFAULT_VPC_CHILDREN) {
            manager.registerResource(child, Map.of(
                    Node.DEFAULT_FLAG, "true",
                    "vpcId", DEFAULT_VPC.id()));
            manager.addRelationship(DEFAULT_VPC, child, RelationshipKind.CONTAINS);
        }
        log.info("Seeded default network topology: {} with {} children",
                DEFAULT_VPC, DEFAULT_VPC_CHILDREN.size());
    }
}
