package com.flamingo.ai.esgmaturity.domain.model;

import com.flamingo.ai.esgmaturity.exception.InvalidInputException;

/**
 * Identifies the organisation being assessed.
 *
 * @param id stable organisation id (CIK, LEI or slug), used in artifact names and file layouts
 * @param name display name
 * @param ticker optional exchange ticker
 */
public record CompanyRef(String id, String name, String ticker) {

  public CompanyRef {
    if (id == null || id.isBlank()) {
      throw new InvalidInputException("company id is required");
    }
    if (name == null || name.isBlank()) {
      name = id;
    }
  }

  public static CompanyRef of(String id) {
    return new CompanyRef(id, id, null);
  }
}
