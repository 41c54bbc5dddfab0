package com.cloud.emulator.service.iam;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of names stored under one key: the policy ARNs attached to a principal,
 * the members of a group, or the roles of an instance profile.
 */
public class NameList {
    private List<String> names = new ArrayList<>();

    public NameList() {
    }

    public NameList(List<String> names) {
        this.names = new ArrayList<>(names);
    }

    public List<String> getNames() {
        return names;
    }

    public void setNames(List<String> names) {
        this.names = names == null ? new ArrayList<>() : new ArrayList<>(names);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean add(String name) {
        if (names.contains(name)) {
            return false;
        }
        return names.add(name);
    }

    public boolean remove(String name) {
        return names.remove(name);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }
}
