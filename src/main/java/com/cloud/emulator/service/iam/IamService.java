package com.cloud.emulator.service.iam;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import com.cloud.emulator.logging.LogContext;
import com.cloud.emulator.manager.ResourceManager;
import com.cloud.emulator.schema.ProviderSchema;
import com.cloud.emulator.service.CompensatingTransaction;
import com.cloud.emulator.service.GraphBackedService;
import com.cloud.emulator.service.ServiceException;
import com.cloud.emulator.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emulated identity service: users, access keys, roles, groups, managed policies
 * and instance profiles.
 *
 * <p>Records live in the {@link StateStore}. Every resource is also registered with the
 * {@link ResourceManager}, and the following relationships are recorded:</p>
 * <ul>
 *   <li>{@code policy ASSOCIATED_WITH role|group|user} while the policy is attached</li>
 *   <li>{@code user ASSOCIATED_WITH group} while the user is a member</li>
 *   <li>{@code user CONTAINS access-key}</li>
 *   <li>{@code instance-profile CONTAINS role}</li>
 * </ul>
 */
public class IamService extends GraphBackedService {
    private static final Logger log = LoggerFactory.getLogger(IamService.class);

    public static final String SERVICE = ProviderSchema.IAM;
    public static final String ACCOUNT_ID = "123456789012";

    public static final String NO_SUCH_ENTITY = "NoSuchEntity";
    public static final String ENTITY_ALREADY_EXISTS = "EntityAlreadyExists";
    public static final String DELETE_CONFLICT = "DeleteConflict";
    public static final String LIMIT_EXCEEDED = "LimitExceeded";

    private static final String ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
    private static final String SECRET_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    private final SecureRandom random = new SecureRandom();

    /**
     * Principals a managed policy can be attached to.
     */
    public enum PrincipalType {
        ROLE("role", "AttachRolePolicy", "DetachRolePolicy"),
        GROUP("group", "AttachGroupPolicy", "DetachGroupPolicy"),
        USER("user", "AttachUserPolicy", "DetachUserPolicy");

        private final String type;
        private final String attachAction;
        private final String detachAction;

        PrincipalType(String type, String attachAction, String detachAction) {
            this.type = type;
            this.attachAction = attachAction;
            this.detachAction = detachAction;
        }

        public String getType() {
            return type;
        }

        ResourceId resourceId(String name) {
            return ResourceId.of(SERVICE, type, name);
        }
    }

    public IamService(StateStore state, ResourceManager resources) {
        super(state, resources);
    }

    // ---- Users ----

    public IamUser createUser(String userName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateUser")) {
            String key = userKey(userName);
            if (state.exists(key)) {
                throw alreadyExists("User", userName);
            }
            IamUser user = new IamUser(userName, newId("AIDA"), arn("user", userName), now());
            create("CreateUser", key, user, userId(userName));
            log.info("Created user {}", userName);
            return user;
        }
    }

    public IamUser getUser(String userName) {
        return state.get(userKey(userName), IamUser.class)
                .orElseThrow(() -> noSuchEntity("user", userName));
    }

    /**
     * Deletes a user. Access keys, group memberships and attached policies must be
     * removed first.
     */
    public void deleteUser(String userName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteUser")) {
            withLock(attachmentsKey(PrincipalType.USER, userName), () -> {
                getUser(userName);
                if (!listAccessKeys(userName).isEmpty()) {
                    throw deleteConflict("Cannot delete entity, must delete access keys first.");
                }
                if (!groupsForUser(userName).isEmpty()) {
                    throw deleteConflict("Cannot delete entity, must remove users from group first.");
                }
                requireNoAttachedPolicies(PrincipalType.USER, userName);
                untrack(userId(userName), 409, DELETE_CONFLICT);
                state.delete(userKey(userName));
            });
            log.info("Deleted user {}", userName);
        }
    }

    // ---- Access keys ----

    public AccessKey createAccessKey(String userName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateAccessKey")) {
            getUser(userName);
            String accessKeyId = newId("AKIA");
            AccessKey key = new AccessKey(accessKeyId, userName, randomString(SECRET_ALPHABET, 40),
                    AccessKey.ACTIVE, now());
            ResourceId keyId = accessKeyId(accessKeyId);
            try (CompensatingTransaction tx = new CompensatingTransaction("CreateAccessKey")) {
                tx.execute("write access key", () -> state.set(accessKeyKey(accessKeyId), key),
                        () -> state.delete(accessKeyKey(accessKeyId)));
                tx.execute("register access key", () -> track(keyId, Map.of("userName", userName)),
                        () -> forget(keyId));
                tx.execute("link user to access key",
                        () -> link(userId(userName), keyId, RelationshipKind.CONTAINS),
                        () -> unlink(userId(userName), keyId, RelationshipKind.CONTAINS));
                tx.markSuccess();
            }
            return key;
        }
    }

    /**
     * Lists the user's access keys without their secrets.
     */
    public List<AccessKey> listAccessKeys(String userName) {
        getUser(userName);
        List<AccessKey> keys = new ArrayList<>();
        for (String key : state.list(accessKeyKey(""))) {
            state.get(key, AccessKey.class)
                    .filter(k -> userName.equals(k.userName()))
                    .ifPresent(k -> keys.add(new AccessKey(k.accessKeyId(), k.userName(), null,
                            k.status(), k.createDate())));
        }
        return keys;
    }

    public void deleteAccessKey(String userName, String accessKeyId) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteAccessKey")) {
            AccessKey key = state.get(accessKeyKey(accessKeyId), AccessKey.class)
                    .filter(k -> k.userName().equals(userName))
                    .orElseThrow(() -> new ServiceException(404, NO_SUCH_ENTITY,
                            "The Access Key with id " + accessKeyId + " cannot be found."));
            ResourceId keyId = accessKeyId(key.accessKeyId());
            unlink(userId(userName), keyId, RelationshipKind.CONTAINS);
            untrack(keyId, 409, DELETE_CONFLICT);
            state.delete(accessKeyKey(accessKeyId));
        }
    }

    // ---- Roles ----

    public IamRole createRole(String roleName, String assumeRolePolicyDocument) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateRole")) {
            String key = roleKey(roleName);
            if (state.exists(key)) {
                throw alreadyExists("Role", roleName);
            }
            IamRole role = new IamRole(roleName, newId("AROA"), arn("role", roleName),
                    assumeRolePolicyDocument, now());
            create("CreateRole", key, role, roleId(roleName));
            log.info("Created role {}", roleName);
            return role;
        }
    }

    public IamRole getRole(String roleName) {
        return state.get(roleKey(roleName), IamRole.class)
                .orElseThrow(() -> noSuchEntity("role", roleName));
    }

    /**
     * Deletes a role. The role must be detached from every policy and removed from
     * every instance profile first.
     */
    public void deleteRole(String roleName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteRole")) {
            withLock(attachmentsKey(PrincipalType.ROLE, roleName), () -> {
                getRole(roleName);
                for (String key : state.list(profileRolesKey(""))) {
                    boolean inProfile = state.get(key, NameList.class)
                            .map(roles -> roles.contains(roleName))
                            .orElse(false);
                    if (inProfile) {
                        throw deleteConflict("Cannot delete entity, must remove roles from instance profile first.");
                    }
                }
                requireNoAttachedPolicies(PrincipalType.ROLE, roleName);
                untrack(roleId(roleName), 409, DELETE_CONFLICT);
                state.delete(roleKey(roleName));
            });
            log.info("Deleted role {}", roleName);
        }
    }

    // ---- Groups ----

    public IamGroup createGroup(String groupName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateGroup")) {
            String key = groupKey(groupName);
            if (state.exists(key)) {
                throw alreadyExists("Group", groupName);
            }
            IamGroup group = new IamGroup(groupName, newId("AGPA"), arn("group", groupName), now());
            create("CreateGroup", key, group, groupId(groupName));
            return group;
        }
    }

    public IamGroup getGroup(String groupName) {
        return state.get(groupKey(groupName), IamGroup.class)
                .orElseThrow(() -> noSuchEntity("group", groupName));
    }

    /**
     * Deletes a group. Members and attached policies block the delete.
     */
    public void deleteGroup(String groupName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteGroup")) {
            withLock(attachmentsKey(PrincipalType.GROUP, groupName), () ->
                    withLock(membersKey(groupName), () -> {
                        getGroup(groupName);
                        if (!listGroupMembers(groupName).isEmpty()) {
                            throw deleteConflict("Cannot delete entity, must remove users from group first.");
                        }
                        requireNoAttachedPolicies(PrincipalType.GROUP, groupName);
                        untrack(groupId(groupName), 409, DELETE_CONFLICT);
                        state.delete(groupKey(groupName));
                    }));
        }
    }

    public void addUserToGroup(String groupName, String userName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "AddUserToGroup")) {
            String key = membersKey(groupName);
            withLock(key, () -> {
                getGroup(groupName);
                getUser(userName);
                if (containsName(key, userName)) {
                    return;
                }
                try (CompensatingTransaction tx = new CompensatingTransaction("AddUserToGroup")) {
                    tx.execute("write group members", () -> addName(key, userName),
                            () -> removeName(key, userName));
                    tx.execute("link user to group",
                            () -> link(userId(userName), groupId(groupName), RelationshipKind.ASSOCIATED_WITH),
                            () -> unlink(userId(userName), groupId(groupName), RelationshipKind.ASSOCIATED_WITH));
                    tx.markSuccess();
                }
            });
        }
    }

    public void removeUserFromGroup(String groupName, String userName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "RemoveUserFromGroup")) {
            String key = membersKey(groupName);
            withLock(key, () -> {
                getGroup(groupName);
                if (!removeName(key, userName)) {
                    throw noSuchEntity("user", userName);
                }
                unlink(userId(userName), groupId(groupName), RelationshipKind.ASSOCIATED_WITH);
            });
        }
    }

    public List<String> listGroupMembers(String groupName) {
        getGroup(groupName);
        return state.get(membersKey(groupName), NameList.class)
                .map(NameList::getNames)
                .map(List::copyOf)
                .orElse(List.of());
    }

    // ---- Managed policies ----

    public ManagedPolicy createPolicy(String policyName, String policyDocument) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreatePolicy")) {
            String policyArn = arn("policy", policyName);
            String key = policyKey(policyArn);
            if (state.exists(key)) {
                throw new ServiceException(409, ENTITY_ALREADY_EXISTS,
                        "A policy called " + policyName + " already exists. Duplicate names are not allowed.");
            }
            ManagedPolicy policy = new ManagedPolicy(policyName, newId("ANPA"), policyArn, policyDocument, now());
            create("CreatePolicy", key, policy, policyId(policyName));
            return policy;
        }
    }

    public ManagedPolicy getPolicy(String policyArn) {
        return state.get(policyKey(policyArn), ManagedPolicy.class)
                .orElseThrow(() -> new ServiceException(404, NO_SUCH_ENTITY,
                        "Policy " + policyArn + " was not found."));
    }

    public void deletePolicy(String policyArn) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeletePolicy")) {
            ManagedPolicy policy = getPolicy(policyArn);
            if (policy.getAttachmentCount() > 0) {
                throw deleteConflict("Cannot delete a policy attached to entities.");
            }
            untrack(policyId(policy.getPolicyName()), 409, DELETE_CONFLICT);
            state.delete(policyKey(policyArn));
        }
    }

    public void attachRolePolicy(String roleName, String policyArn) {
        attachPolicy(PrincipalType.ROLE, roleName, policyArn);
    }

    public void detachRolePolicy(String roleName, String policyArn) {
        detachPolicy(PrincipalType.ROLE, roleName, policyArn);
    }

    public List<String> listAttachedRolePolicies(String roleName) {
        return listAttachedPolicies(PrincipalType.ROLE, roleName);
    }

    public void attachGroupPolicy(String groupName, String policyArn) {
        attachPolicy(PrincipalType.GROUP, groupName, policyArn);
    }

    public void detachGroupPolicy(String groupName, String policyArn) {
        detachPolicy(PrincipalType.GROUP, groupName, policyArn);
    }

    public List<String> listAttachedGroupPolicies(String groupName) {
        return listAttachedPolicies(PrincipalType.GROUP, groupName);
    }

    public void attachUserPolicy(String userName, String policyArn) {
        attachPolicy(PrincipalType.USER, userName, policyArn);
    }

    public void detachUserPolicy(String userName, String policyArn) {
        detachPolicy(PrincipalType.USER, userName, policyArn);
    }

    public List<String> listAttachedUserPolicies(String userName) {
        return listAttachedPolicies(PrincipalType.USER, userName);
    }

    /**
     * Attaches a managed policy. The attachment list is written first, then the
     * relationship is recorded and the policy's attachment count incremented; a failure
     * in any step undoes the earlier ones. Attaching an already attached policy is a no-op.
     */
    public void attachPolicy(PrincipalType principal, String name, String policyArn) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, principal.attachAction)) {
            String key = attachmentsKey(principal, name);
            withLock(key, () -> {
                requirePrincipal(principal, name);
                ManagedPolicy policy = getPolicy(policyArn);
                if (containsName(key, policyArn)) {
                    return;
                }
                ResourceId policyId = policyId(policy.getPolicyName());
                ResourceId principalId = principal.resourceId(name);
                try (CompensatingTransaction tx = new CompensatingTransaction(principal.attachAction)) {
                    tx.execute("write attachment list", () -> addName(key, policyArn),
                            () -> removeName(key, policyArn));
                    tx.execute("link policy to " + principal.type,
                            () -> link(policyId, principalId, RelationshipKind.ASSOCIATED_WITH),
                            () -> unlink(policyId, principalId, RelationshipKind.ASSOCIATED_WITH));
                    tx.execute("increment attachment count",
                            () -> adjustAttachmentCount(policyArn, 1),
                            () -> adjustAttachmentCount(policyArn, -1));
                    tx.markSuccess();
                }
            });
            log.debug("Attached {} to {} {}", policyArn, principal.type, name);
        }
    }

    public void detachPolicy(PrincipalType principal, String name, String policyArn) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, principal.detachAction)) {
            String key = attachmentsKey(principal, name);
            withLock(key, () -> {
                requirePrincipal(principal, name);
                ManagedPolicy policy = getPolicy(policyArn);
                if (!removeName(key, policyArn)) {
                    throw new ServiceException(404, NO_SUCH_ENTITY,
                            "Policy " + policyArn + " was not found.");
                }
                unlink(policyId(policy.getPolicyName()), principal.resourceId(name), RelationshipKind.ASSOCIATED_WITH);
                adjustAttachmentCount(policyArn, -1);
            });
        }
    }

    public List<String> listAttachedPolicies(PrincipalType principal, String name) {
        requirePrincipal(principal, name);
        return state.get(attachmentsKey(principal, name), NameList.class)
                .map(NameList::getNames)
                .map(List::copyOf)
                .orElse(List.of());
    }

    // ---- Instance profiles ----

    public InstanceProfile createInstanceProfile(String profileName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "CreateInstanceProfile")) {
            String key = profileKey(profileName);
            if (state.exists(key)) {
                throw alreadyExists("Instance Profile", profileName);
            }
            InstanceProfile profile = new InstanceProfile(profileName, newId("AIPA"),
                    arn("instance-profile", profileName), now());
            create("CreateInstanceProfile", key, profile, profileId(profileName));
            return profile;
        }
    }

    public InstanceProfile getInstanceProfile(String profileName) {
        return state.get(profileKey(profileName), InstanceProfile.class)
                .orElseThrow(() -> noSuchEntity("instance profile", profileName));
    }

    public List<String> listInstanceProfileRoles(String profileName) {
        getInstanceProfile(profileName);
        return state.get(profileRolesKey(profileName), NameList.class)
                .map(NameList::getNames)
                .map(List::copyOf)
                .orElse(List.of());
    }

    /**
     * Deletes an instance profile. A profile that still holds a role cannot be deleted.
     */
    public void deleteInstanceProfile(String profileName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "DeleteInstanceProfile")) {
            withLock(profileRolesKey(profileName), () -> {
                getInstanceProfile(profileName);
                if (!listInstanceProfileRoles(profileName).isEmpty()) {
                    throw deleteConflict("Cannot delete entity, must remove roles from instance profile first.");
                }
                untrack(profileId(profileName), 409, DELETE_CONFLICT);
                state.delete(profileKey(profileName));
            });
        }
    }

    public void addRoleToInstanceProfile(String profileName, String roleName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "AddRoleToInstanceProfile")) {
            String key = profileRolesKey(profileName);
            withLock(key, () -> {
                getInstanceProfile(profileName);
                getRole(roleName);
                if (!listInstanceProfileRoles(profileName).isEmpty()) {
                    throw new ServiceException(409, LIMIT_EXCEEDED,
                            "Cannot exceed quota for InstanceSessionsPerInstanceProfile: 1");
                }
                try (CompensatingTransaction tx = new CompensatingTransaction("AddRoleToInstanceProfile")) {
                    tx.execute("write profile roles", () -> addName(key, roleName),
                            () -> removeName(key, roleName));
                    tx.execute("link profile to role",
                            () -> link(profileId(profileName), roleId(roleName), RelationshipKind.CONTAINS),
                            () -> unlink(profileId(profileName), roleId(roleName), RelationshipKind.CONTAINS));
                    tx.markSuccess();
                }
            });
        }
    }

    public void removeRoleFromInstanceProfile(String profileName, String roleName) {
        try (LogContext ctx = LogContext.forServiceCall(SERVICE, "RemoveRoleFromInstanceProfile")) {
            String key = profileRolesKey(profileName);
            withLock(key, () -> {
                getInstanceProfile(profileName);
                if (!removeName(key, roleName)) {
                    throw noSuchEntity("role", roleName);
                }
                unlink(profileId(profileName), roleId(roleName), RelationshipKind.CONTAINS);
            });
        }
    }

    // ---- Helpers ----

    private void create(String action, String key, Object record, ResourceId id) {
        try (CompensatingTransaction tx = new CompensatingTransaction(action)) {
            tx.execute("write record", () -> state.set(key, record), () -> state.delete(key));
            tx.execute("register resource", () -> track(id, Map.of()), () -> forget(id));
            tx.markSuccess();
        }
    }

    private boolean containsName(String key, String name) {
        return state.get(key, NameList.class)
                .map(names -> names.contains(name))
                .orElse(false);
    }

    /**
     * Adds {@code name} to the list under {@code key}, creating the list if needed.
     */
    private boolean addName(String key, String name) {
        boolean[] added = new boolean[1];
        state.compute(key, NameList.class, names -> {
            NameList list = names == null ? new NameList() : names;
            added[0] = list.add(name);
            return list;
        });
        return added[0];
    }

    /**
     * Removes {@code name} from the list under {@code key}. An emptied list is deleted.
     */
    private boolean removeName(String key, String name) {
        boolean[] removed = new boolean[1];
        state.compute(key, NameList.class, names -> {
            if (names == null) {
                return null;
            }
            removed[0] = names.remove(name);
            return names.isEmpty() ? null : names;
        });
        return removed[0];
    }

    private void requireNoAttachedPolicies(PrincipalType principal, String name) {
        if (state.get(attachmentsKey(principal, name), NameList.class).map(l -> !l.isEmpty()).orElse(false)) {
            throw deleteConflict("Cannot delete entity, must detach all policies first.");
        }
    }

    private void requirePrincipal(PrincipalType principal, String name) {
        switch (principal) {
            case ROLE -> getRole(name);
            case GROUP -> getGroup(name);
            case USER -> getUser(name);
        }
    }

    private void adjustAttachmentCount(String policyArn, int delta) {
        state.update(policyKey(policyArn), ManagedPolicy.class,
                p -> p.setAttachmentCount(Math.max(0, p.getAttachmentCount() + delta)));
    }

    private List<String> groupsForUser(String userName) {
        List<String> groups = new ArrayList<>();
        String prefix = membersKey("");
        for (String key : state.list(prefix)) {
            Optional<NameList> members = state.get(key, NameList.class);
            if (members.isPresent() && members.get().contains(userName)) {
                groups.add(key.substring(prefix.length()));
            }
        }
        return groups;
    }

    private String newId(String prefix) {
        return prefix + randomString(ID_ALPHABET, 16);
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private static String now() {
        return Instant.now().toString();
    }

    static String arn(String type, String name) {
        return "arn:aws:iam::" + ACCOUNT_ID + ":" + type + "/" + name;
    }

    static ResourceId userId(String name) {
        return ResourceId.of(SERVICE, "user", name);
    }

    static ResourceId roleId(String name) {
        return ResourceId.of(SERVICE, "role", name);
    }

    static ResourceId groupId(String name) {
        return ResourceId.of(SERVICE, "group", name);
    }

    static ResourceId policyId(String name) {
        return ResourceId.of(SERVICE, "policy", name);
    }

    static ResourceId accessKeyId(String id) {
        return ResourceId.of(SERVICE, "access-key", id);
    }

    static ResourceId profileId(String name) {
        return ResourceId.of(SERVICE, "instance-profile", name);
    }

    private static String userKey(String name) {
        return "iam/user/" + name;
    }

    private static String roleKey(String name) {
        return "iam/role/" + name;
    }

    private static String groupKey(String name) {
        return "iam/group/" + name;
    }

    private static String policyKey(String arn) {
        return "iam/policy/" + arn;
    }

    private static String accessKeyKey(String id) {
        return "iam/access-key/" + id;
    }

    private static String profileKey(String name) {
        return "iam/instance-profile/" + name;
    }

    private static String profileRolesKey(String name) {
        return "iam/instance-profile-roles/" + name;
    }

    private static String membersKey(String groupName) {
        return "iam/group-members/" + groupName;
    }

    private static String attachmentsKey(PrincipalType principal, String name) {
        return "iam/attached/" + principal.type + "/" + name;
    }

    private static ServiceException noSuchEntity(String entity, String name) {
        return new ServiceException(404, NO_SUCH_ENTITY,
                "The " + entity + " with name " + name + " cannot be found.");
    }

    private static ServiceException alreadyExists(String entity, String name) {
        return new ServiceException(409, ENTITY_ALREADY_EXISTS,
                entity + " with name " + name + " already exists.");
    }

    private static ServiceException deleteConflict(String message) {
        return new ServiceException(409, DELETE_CONFLICT, message);
    }
}
