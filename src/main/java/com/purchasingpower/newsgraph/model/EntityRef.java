package com.purchasingpower.newsgraph.model;

/**
 * Named entity mentioned by an article. The name is the identity; the type is overwritten on every attach.
 */
public record EntityRef(String name, String type) {
}
