//
// ApiView - renders the public API surface of compiled code
// http://github.com/scaled/codex/blob/master/LICENSE

package apiview.model;

/**
 * Denotes the different kinds of members nested in a type.
 */
public enum MemberKind {

  // note: the order of these elements dictates the order in which members are grouped in the
  // output, see DefaultOrderPolicy

  /** A field, constant or enum member. */
  FIELD,
  CONSTRUCTOR,
  /** A property. A property with parameters is an indexer. */
  PROPERTY,
  EVENT,
  METHOD,
  /** A compiler synthesized backing method of a property or event (get, set, add, remove, raise).
    * These never appear in the output, the owning property or event stands for them. */
  ACCESSOR,
  /** A member the provider could not classify. These are rendered in a degraded form. */
  UNKNOWN;
}
