package ca.gc.cra.netsim.domain.acl;

import ca.gc.cra.netsim.validation.Strings;
import java.util.Objects;

/**
 * Identifier of an access list: either a number or a name, never both.
 *
 * @param number list number, or {@code null} for a named list
 * @param name list name, or {@code null} for a numbered list
 * @since 0.1.0
 */
public record AclId(Integer number, String name) {
  /**
   * Ensures exactly one of the two forms is present.
   */
  public AclId {
    if ((number == null) == (name == null)) {
      throw new IllegalArgumentException("ACL id needs exactly one of number or name");
    }
    if (name != null) {
      name = Strings.requireIdentifier("ACL name", name);
    }
  }

  /**
   * Numbered identifier.
   *
   * @param number list number
   * @return id
   */
  public static AclId of(int number) {
    if (number <= 0) {
      throw new IllegalArgumentException("ACL number must be positive (was " + number + ")");
    }
    return new AclId(number, null);
  }

  /**
   * Named identifier.
   *
   * @param name list name
   * @return id
   */
  public static AclId named(String name) {
    return new AclId(null, Objects.requireNonNull(name, "name"));
  }

  /**
   * Parses a CLI token: all digits means a numbered list, anything else a name.
   *
   * @param token token
   * @return id
   */
  public static AclId parse(String token) {
    String value = Strings.requireNonBlank("ACL id", token);
    if (value.chars().allMatch(Character::isDigit)) {
      try {
        return of(Integer.parseInt(value));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("ACL number out of range: " + value, ex);
      }
    }
    return named(value);
  }

  /** @return {@code true} for numbered lists */
  public boolean isNumbered() {
    return number != null;
  }

  @Override
  public String toString() {
    return number != null ? number.toString() : name;
  }
}
