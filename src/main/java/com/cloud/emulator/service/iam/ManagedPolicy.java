package com.cloud.emulator.service.iam;

/**
 * Customer managed policy. {@code attachmentCount} tracks how many roles, groups and users
 * the policy is attached to.
 */
public class ManagedPolicy {
    private String policyName;
    private String policyId;
    private String arn;
    private String policyDocument;
    private int attachmentCount;
    private String createDate;

    public ManagedPolicy() {
    }

    public ManagedPolicy(String policyName, String policyId, String arn, String policyDocument, String createDate) {
        this.policyName = policyName;
        this.policyId = policyId;
        this.arn = arn;
        this.policyDocument = policyDocument;
        this.createDate = createDate;
    }

    public String getPolicyName() {
        return policyName;
    }

    public void setPolicyName(String policyName) {
        this.policyName = policyName;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public String getArn() {
        return arn;
    }

    public void setArn(String arn) {
        this.arn = arn;
    }

    public String getPolicyDocument() {
        return policyDocument;
    }

    public void setPolicyDocument(String policyDocument) {
        this.policyDocument = policyDocument;
    }

    public int getAttachmentCount() {
        return attachmentCount;
    }

    public void setAttachmentCount(int attachmentCount) {
        this.attachmentCount = attachmentCount;
    }

    public String getCreateDate() {
        return createDate;
    }

    public void setCreateDate(String createDate) {
        this.createDate = createDate;
    }
}
