package com.cloud.emulator.service.ec2;

import com.cloud.emulator.core.model.Node;
import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.dependency.DeletionCheck;
import com.cloud.emulator.logging.LogContext;
import com.cloud.emulator.manager.DefaultNetworkTopology;
import com.cloud.emulator.manager.ResourceManager;
import com.cloud.emulator.schema.ProviderSchema;
import com.cloud.emulator.service.CompensatingTransaction;
import com.cloud.emulator.service.GraphBackedService;
import com.cloud.emulator.service.ServiceException;
import com.cloud.emulator.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emulated network service: VPCs, subnets and security groups.
 *
 * <p>Each VPC contains its subnets and security groups, plus a main route table and a
 * {@code default} security group created along with it. Those two are removed
 * automatically when the VPC is deleted; any other contained resource blocks the delete
 * with {@code DependencyViolation}. Resources carrying {@code default=true} metadata
 * (the provider's default VPC and its children) cannot be deleted at all.</p>
 *
 * <p>The resource manager is expected to be pre-seeded with
 * {@link DefaultNetworkTopology}; the constructor writes matching records to the state
 * store.</p>
 */
public class NetworkService extends GraphBackedService {
    private static final Logger log = LoggerFactory.getLogger(NetworkService.class);

    public static final String SERVICE = ProviderSchema.EC2;

    public static final String INVALID_VPC_NOT_FOUND = "InvalidVpcID.NotFound";
    public static final String INVALID_SUBNET_NOT_FOUND = "InvalidSubnetID.NotFound";
    public static final String INVALID_GROUP_NOT_FOUND = "InvalidGroup.NotFound";
    public static final String INVALID_GROUP_DUPLICATE = "InvalidGroup.Duplicate";
    public static final String OPERATION_NOT_PERMITTED = "OperationNotPermitted";
    public static final String DEPENDENCY_VIOLATION = "DependencyViolation";

    static final String DEFAULT_VPC_CIDR = "172.31.0.0/16";
    static final String DEFAULT_SUBNET_CIDR = "172.31.0.0/20";

    private final SecureRandom random = new SecureRandom();

    public NetworkService(StateStore state, ResourceManager resources) {
        super(state, resources);
        seedDefaultRecords();
    }

    // ---- VPCs ----

    /**
     * Creates a VPC together with its main route table and default security group.
     */
    public Vpc createVpc(String cidrBlock) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateVpc")) {
            Vpc vpc = new Vpc(newId("vpc-"), cidrBlock, false);
            RouteTable mainTable = new RouteTable(newId("rtb-"), vpc.vpcId(), true);
            SecurityGroup defaultGroup = new SecurityGroup(newId("sg-"), SecurityGroup.DEFAULT_GROUP_NAME,
                    "default VPC security group", vpc.vpcId());

            ResourceId vpcId = vpcId(vpc.vpcId());
            ResourceId tableId = routeTableId(mainTable.routeTableId());
            ResourceId groupId = securityGroupId(defaultGroup.groupId());
            try (CompensatingTransaction tx = new CompensatingTransaction("CreateVpc")) {
                tx.execute("write vpc", () -> state.set(vpcKey(vpc.vpcId()), vpc),
                        () -> state.delete(vpcKey(vpc.vpcId())));
                tx.execute("register vpc", () -> track(vpcId, Map.of("cidrBlock", cidrBlock)),
                        () -> forget(vpcId));
                addChild(tx, vpcId, tableId, routeTableKey(mainTable.routeTableId()), mainTable,
                        Map.of("vpcId", vpc.vpcId(), "main", "true"));
                addChild(tx, vpcId, groupId, securityGroupKey(defaultGroup.groupId()), defaultGroup,
                        Map.of("vpcId", vpc.vpcId(), "groupName", SecurityGroup.DEFAULT_GROUP_NAME));
                tx.markSuccess();
            }
            log.info("Created VPC {} ({})", vpc.vpcId(), cidrBlock);
            return vpc;
        }
    }

    public Vpc getVpc(String vpcId) {
        return state.get(vpcKey(vpcId), Vpc.class)
                .orElseThrow(() -> new ServiceException(400, INVALID_VPC_NOT_FOUND,
                        "The vpc ID '" + vpcId + "' does not exist"));
    }

    public List<Vpc> listVpcs() {
        return list(vpcKey(""), Vpc.class);
    }

    /**
     * Deletes a VPC. The default VPC is never deletable. Subnets, non-default security
     * groups and anything else the VPC contains must be deleted first; the main route
     * table and the default security group go away with the VPC.
     */
    public void deleteVpc(String vpcId) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteVpc")) {
            Vpc vpc = getVpc(vpcId);
            ResourceId id = vpcId(vpcId);
            if (vpc.defaultVpc() || isDefault(id)) {
                throw new ServiceException(400, OPERATION_NOT_PERMITTED,
                        "The default VPC '" + vpcId + "' cannot be deleted");
            }

            Map<ResourceId, String> managed = managedChildren(vpcId);
            List<ResourceId> blockers = new ArrayList<>(dependents(id));
            blockers.removeAll(managed.keySet());
            if (!blockers.isEmpty()) {
                throw new ServiceException(400, DEPENDENCY_VIOLATION,
                        "The vpc '" + vpcId + "' has dependencies and cannot be deleted: " + blockers);
            }

            try (CompensatingTransaction tx = new CompensatingTransaction("DeleteVpc")) {
                for (Map.Entry<ResourceId, String> child : managed.entrySet()) {
                    ResourceId childId = child.getKey();
                    Map<String, String> metadata = resources.getResource(childId)
                            .map(Node::getMetadata)
                            .orElse(Map.of());
                    tx.execute("unregister " + childId,
                            () -> untrack(childId, 400, DEPENDENCY_VIOLATION),
                            () -> {
                                track(childId, metadata);
                                link(id, childId, RelationshipKind.CONTAINS);
                            });
                }
                tx.execute("unregister vpc", () -> untrack(id, 400, DEPENDENCY_VIOLATION), () -> {
                });
                tx.markSuccess();
            }
            managed.values().forEach(this::deleteIfExists);
            deleteIfExists(vpcKey(vpcId));
            log.info("Deleted VPC {}", vpcId);
        }
    }

    // ---- Subnets ----

    public Subnet createSubnet(String vpcId, String cidrBlock) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateSubnet")) {
            getVpc(vpcId);
            Subnet subnet = new Subnet(newId("subnet-"), vpcId, cidrBlock, false);
            try (CompensatingTransaction tx = new CompensatingTransaction("CreateSubnet")) {
                addChild(tx, vpcId(vpcId), subnetId(subnet.subnetId()), subnetKey(subnet.subnetId()), subnet,
                        Map.of("vpcId", vpcId, "cidrBlock", cidrBlock));
                tx.markSuccess();
            }
            return subnet;
        }
    }

    public Subnet getSubnet(String subnetId) {
        return state.get(subnetKey(subnetId), Subnet.class)
                .orElseThrow(() -> new ServiceException(400, INVALID_SUBNET_NOT_FOUND,
                        "The subnet ID '" + subnetId + "' does not exist"));
    }

    public List<Subnet> listSubnets(String vpcId) {
        return list(subnetKey(""), Subnet.class).stream()
                .filter(s -> s.vpcId().equals(vpcId))
                .toList();
    }

    public void deleteSubnet(String subnetId) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteSubnet")) {
            Subnet subnet = getSubnet(subnetId);
            ResourceId id = subnetId(subnetId);
            requireDeletable(id, subnet.defaultForAz());
            untrack(id, 400, DEPENDENCY_VIOLATION);
            state.delete(subnetKey(subnetId));
        }
    }

    // ---- Security groups ----

    public SecurityGroup createSecurityGroup(String vpcId, String groupName, String description) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateSecurityGroup")) {
            getVpc(vpcId);
            boolean duplicate = list(securityGroupKey(""), SecurityGroup.class).stream()
                    .anyMatch(g -> g.vpcId().equals(vpcId) && g.groupName().equals(groupName));
            if (duplicate) {
                throw new ServiceException(400, INVALID_GROUP_DUPLICATE,
                        "The security group '" + groupName + "' already exists for VPC '" + vpcId + "'");
            }
            SecurityGroup group = new SecurityGroup(newId("sg-"), groupName, description, vpcId);
            try (CompensatingTransaction tx = new CompensatingTransaction("CreateSecurityGroup")) {
                addChild(tx, vpcId(vpcId), securityGroupId(group.groupId()), securityGroupKey(group.groupId()),
                        group, Map.of("vpcId", vpcId, "groupName", groupName));
                tx.markSuccess();
            }
            return group;
        }
    }

    public SecurityGroup getSecurityGroup(String groupId) {
        return state.get(securityGroupKey(groupId), SecurityGroup.class)
                .orElseThrow(() -> new ServiceException(400, INVALID_GROUP_NOT_FOUND,
                        "The security group '" + groupId + "' does not exist"));
    }

    /**
     * Deletes a security group. A VPC's {@code default} group is only removed with its VPC.
     */
    public void deleteSecurityGroup(String groupId) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteSecurityGroup")) {
            SecurityGroup group = getSecurityGroup(groupId);
            ResourceId id = securityGroupId(groupId);
            requireDeletable(id, SecurityGroup.DEFAULT_GROUP_NAME.equals(group.groupName()));
            untrack(id, 400, DEPENDENCY_VIOLATION);
            state.delete(securityGroupKey(groupId));
        }
    }

    // ---- Helpers ----

    private void addChild(CompensatingTransaction tx, ResourceId parent, ResourceId child, String key,
                          Object record, Map<String, String> metadata) {
        tx.execute("write " + child.type(), () -> state.set(key, record), () -> state.delete(key));
        tx.execute("register " + child.type(), () -> track(child, metadata), () -> forget(child));
        tx.execute("link " + parent.type() + " to " + child.type(),
                () -> link(parent, child, RelationshipKind.CONTAINS),
                () -> unlink(parent, child, RelationshipKind.CONTAINS));
    }

    private void requireDeletable(ResourceId id, boolean defaultRecord) {
        if (defaultRecord || isDefault(id)) {
            throw new ServiceException(400, OPERATION_NOT_PERMITTED,
                    "The " + id.type() + " '" + id.id() + "' is a default resource and cannot be deleted");
        }
    }

    private boolean isDefault(ResourceId id) {
        return resources.getResource(id).map(Node::isDefault).orElse(false);
    }

    private List<ResourceId> dependents(ResourceId id) {
        if (!resources.hasResource(id)) {
            return List.of();
        }
        DeletionCheck check = resources.canDelete(id);
        return check.blockers();
    }

    /**
     * Main route table and default security group of the VPC, keyed by resource id with
     * their state keys as values.
     */
    private Map<ResourceId, String> managedChildren(String vpcId) {
        Map<ResourceId, String> managed = new LinkedHashMap<>();
        for (RouteTable table : list(routeTableKey(""), RouteTable.class)) {
            if (table.vpcId().equals(vpcId) && table.main()) {
                managed.put(routeTableId(table.routeTableId()), routeTableKey(table.routeTableId()));
            }
        }
        for (SecurityGroup group : list(securityGroupKey(""), SecurityGroup.class)) {
            if (group.vpcId().equals(vpcId) && SecurityGroup.DEFAULT_GROUP_NAME.equals(group.groupName())) {
                managed.put(securityGroupId(group.groupId()), securityGroupKey(group.groupId()));
            }
        }
        return managed;
    }

    private void seedDefaultRecords() {
        String vpcId = DefaultNetworkTopology.DEFAULT_VPC.id();
        if (state.exists(vpcKey(vpcId))) {
            return;
        }
        state.set(vpcKey(vpcId), new Vpc(vpcId, DEFAULT_VPC_CIDR, true));
        String subnetId = DefaultNetworkTopology.DEFAULT_SUBNET.id();
        state.set(subnetKey(subnetId), new Subnet(subnetId, vpcId, DEFAULT_SUBNET_CIDR, true));
        String tableId = DefaultNetworkTopology.DEFAULT_ROUTE_TABLE.id();
        state.set(routeTableKey(tableId), new RouteTable(tableId, vpcId, true));
        String groupId = DefaultNetworkTopology.DEFAULT_SECURITY_GROUP.id();
        state.set(securityGroupKey(groupId), new SecurityGroup(groupId, SecurityGroup.DEFAULT_GROUP_NAME,
                "default VPC security group", vpcId));
        log.info("Seeded default VPC records for {}", vpcId);
    }

    private <T> List<T> list(String prefix, Class<T> type) {
        List<T> records = new ArrayList<>();
        for (String key : state.list(prefix)) {
            state.get(key, type).ifPresent(records::add);
        }
        return records;
    }

    private String newId(String prefix) {
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = 0; i < 17; i++) {
            sb.append(Character.forDigit(random.nextInt(16), 16));
        }
        return sb.toString();
    }

    static ResourceId vpcId(String id) {
        return ResourceId.of(SERVICE, "vpc", id);
    }

    static ResourceId subnetId(String id) {
        return ResourceId.of(SERVICE, "subnet", id);
    }

    static ResourceId securityGroupId(String id) {
        return ResourceId.of(SERVICE, "security-group", id);
    }

    static ResourceId routeTableId(String id) {
        return ResourceId.of(SERVICE, "route-table", id);
    }

    private static String vpcKey(String id) {
        return "ec2/vpc/" + id;
    }

    private static String subnetKey(String id) {
        return "ec2/subnet/" + id;
    }

    private static String securityGroupKey(String id) {
        return "ec2/security-group/" + id;
    }

    private static String routeTableKey(String id) {
        return "ec2/route-table/" + id;
    }
}
