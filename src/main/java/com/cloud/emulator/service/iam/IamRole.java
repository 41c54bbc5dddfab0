package com.cloud.emulator.service.iam;

public record IamRole(String roleName, String roleId, String arn, String assumeRolePolicyDocument,
                      String createDate) {
}
