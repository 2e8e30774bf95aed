package ca.gc.cra.netsim.domain.ospf;

/**
 * Router-LSA link types (RFC 2328 A.4.2).
 *
 * @since 0.1.0
 */
public enum RouterLinkType {
  POINT_TO_POINT(1),
  TRANSIT(2),
  STUB(3),
  VIRTUAL(4);

  private final int code;

  RouterLinkType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
