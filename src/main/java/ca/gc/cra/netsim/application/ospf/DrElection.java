package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Designated Router election (RFC 2328 §9.4).
 * <p><strong>Algorithm:</strong></p>
 * <ol>
 *   <li>Eligible routers are the calculating router and every neighbor in TwoWay or beyond, priority above 0.</li>
 *   <li>BDR: among routers not declaring themselves DR, those declaring themselves BDR are preferred; highest
 *   priority wins, then highest router ID.</li>
 *   <li>DR: the best router declaring itself DR; if none, the new BDR.</li>
 *   <li>If the calculating router became, or stopped being, DR or BDR, steps 2 and 3 are repeated with its own
 *   declaration updated.</li>
 * </ol>
 * <p>A router that already declares itself DR keeps the role against a newcomer of higher priority, since the
 * newcomer does not declare itself DR.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DrElection {
  private static final Comparator<Candidate> PREFERENCE =
      Comparator.comparingInt(Candidate::priority).thenComparing(Candidate::routerId);

  private DrElection() {
    // Utility
  }

  /**
   * A router taking part in the election, with the DR/BDR it currently declares.
   *
   * @param routerId router ID, the tie breaker
   * @param address interface address on the network
   * @param priority router priority
   * @param declaredDr DR it declares, or {@code 0.0.0.0}
   * @param declaredBdr BDR it declares, or {@code 0.0.0.0}
   */
  public record Candidate(
      Ipv4Address routerId, Ipv4Address address, int priority, Ipv4Address declaredDr, Ipv4Address declaredBdr) {
    public Candidate {
      Objects.requireNonNull(routerId, "routerId");
      Objects.requireNonNull(address, "address");
      declaredDr = declaredDr != null ? declaredDr : Ipv4Address.ANY;
      declaredBdr = declaredBdr != null ? declaredBdr : Ipv4Address.ANY;
    }

    boolean declaresDr() {
      return declaredDr.equals(address);
    }

    boolean declaresBdr() {
      return declaredBdr.equals(address);
    }

    Candidate withDeclarations(Ipv4Address dr, Ipv4Address bdr) {
      return new Candidate(routerId, address, priority, dr, bdr);
    }
  }

  /**
   * Elected DR and BDR interface addresses; {@code 0.0.0.0} when no router is eligible.
   *
   * @param dr designated router
   * @param bdr backup designated router
   */
  public record Result(Ipv4Address dr, Ipv4Address bdr) {
    public Result {
      Objects.requireNonNull(dr, "dr");
      Objects.requireNonNull(bdr, "bdr");
    }
  }

  /**
   * Runs the election as seen by {@code self}.
   *
   * @param self calculating router, with its current DR/BDR as declarations
   * @param neighbors neighbors in TwoWay or beyond
   * @return elected DR and BDR
   */
  public static Result elect(Candidate self, List<Candidate> neighbors) {
    Objects.requireNonNull(self, "self");
    List<Candidate> eligible = new ArrayList<>();
    if (self.priority() > 0) {
      eligible.add(self);
    }
    for (Candidate neighbor : neighbors) {
      if (neighbor.priority() > 0) {
        eligible.add(neighbor);
      }
    }
    Result first = calculate(eligible);
    if (self.priority() == 0) {
      return first;
    }
    boolean wasDr = self.declaresDr();
    boolean wasBdr = self.declaresBdr();
    boolean isDr = first.dr().equals(self.address());
    boolean isBdr = first.bdr().equals(self.address());
    if (wasDr == isDr && wasBdr == isBdr) {
      return first;
    }
    eligible.set(0, self.withDeclarations(first.dr(), first.bdr()));
    return calculate(eligible);
  }

  private static Result calculate(List<Candidate> eligible) {
    List<Candidate> notDr = new ArrayList<>();
    List<Candidate> declaringBdr = new ArrayList<>();
    List<Candidate> declaringDr = new ArrayList<>();
    for (Candidate candidate : eligible) {
      if (candidate.declaresDr()) {
        declaringDr.add(candidate);
      } else {
        notDr.add(candidate);
        if (candidate.declaresBdr()) {
          declaringBdr.add(candidate);
        }
      }
    }
    Optional<Candidate> bdr = best(declaringBdr.isEmpty() ? notDr : declaringBdr);
    Optional<Candidate> dr = declaringDr.isEmpty() ? bdr : best(declaringDr);
    return new Result(
        dr.map(Candidate::address).orElse(Ipv4Address.ANY),
        bdr.map(Candidate::address).orElse(Ipv4Address.ANY));
  }

  private static Optional<Candidate> best(List<Candidate> pool) {
    return pool.stream().max(PREFERENCE);
  }
}
