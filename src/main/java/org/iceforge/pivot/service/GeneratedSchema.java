package org.iceforge.pivot.service;

import java.util.List;

/**
 * A schema draft and the cube names it would register.
 */
public record GeneratedSchema(String xml, List<String> cubes) {
}
