package com.gruelbox.migrationledger;

/** Something whose configuration can be checked by a {@link Validator}. */
public interface Validatable {

  void validate(Validator validator);
}
