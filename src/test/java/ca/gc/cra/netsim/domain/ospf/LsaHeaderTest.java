package ca.gc.cra.netsim.domain.ospf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.List;
import org.junit.jupiter.api.Test;

class LsaHeaderTest {
  private static final Ipv4Address RID = Ipv4Address.parse("1.1.1.1");

  @Test
  void higherSequenceIsNewerUsingSignedComparison() {
    LsaHeader first = header(OspfConstants.INITIAL_SEQUENCE_NUMBER, 0x1000, 0);
    LsaHeader second = header(OspfConstants.INITIAL_SEQUENCE_NUMBER + 1, 0x0001, 0);
    LsaHeader last = header(OspfConstants.MAX_SEQUENCE_NUMBER, 0x0001, 0);

    assertTrue(second.compareInstance(first) > 0);
    assertTrue(first.compareInstance(second) < 0);
    assertTrue(last.compareInstance(second) > 0);
  }

  @Test
  void checksumBreaksSequenceTies() {
    LsaHeader low = header(OspfConstants.INITIAL_SEQUENCE_NUMBER, 0x1000, 0);
    LsaHeader high = header(OspfConstants.INITIAL_SEQUENCE_NUMBER, 0x2000, 0);

    assertTrue(high.compareInstance(low) > 0);
  }

  @Test
  void maxAgeInstanceWinsOverLiveCopy() {
    LsaHeader live = header(OspfConstants.INITIAL_SEQUENCE_NUMBER, 0x1000, 10);
    LsaHeader flushed = live.withAge(OspfConstants.MAX_AGE_SECONDS);

    assertTrue(flushed.isMaxAge());
    assertTrue(flushed.compareInstance(live) > 0);
  }

  @Test
  void agesWithinMaxAgeDiffAreTheSameInstance() {
    LsaHeader young = header(OspfConstants.INITIAL_SEQUENCE_NUMBER, 0x1000, 10);
    LsaHeader older = young.withAge(10 + OspfConstants.MAX_AGE_DIFF_SECONDS);
    LsaHeader muchOlder = young.withAge(11 + OspfConstants.MAX_AGE_DIFF_SECONDS);

    assertEquals(0, young.compareInstance(older));
    assertTrue(young.compareInstance(muchOlder) > 0);
  }

  @Test
  void ageIsCappedAtMaxAge() {
    assertEquals(OspfConstants.MAX_AGE_SECONDS, header(1, 0, 0).withAge(99_999).age());
    assertThrows(IllegalArgumentException.class, () -> header(1, 0, OspfConstants.MAX_AGE_SECONDS + 1));
  }

  @Test
  void originatedLsaCarriesValidChecksumIndependentOfAge() {
    RouterLsa lsa = RouterLsa.originate(RID, OspfConstants.INITIAL_SEQUENCE_NUMBER, 0, List.of(
        new RouterLink(Ipv4Address.parse("10.0.12.0"), Ipv4Address.parse("255.255.255.252"), RouterLinkType.STUB,
            10)));

    assertNotEquals(0, lsa.header().checksum());
    assertTrue(LsaChecksum.verify(lsa));
    RouterLsa aged = new RouterLsa(lsa.header().withAge(1200), lsa.flags(), lsa.links());
    assertTrue(LsaChecksum.verify(aged));
  }

  @Test
  void checksumDetectsChangedContent() {
    RouterLsa lsa = RouterLsa.originate(RID, OspfConstants.INITIAL_SEQUENCE_NUMBER, 0, List.of(
        new RouterLink(Ipv4Address.parse("10.0.12.0"), Ipv4Address.parse("255.255.255.252"), RouterLinkType.STUB,
            10)));
    RouterLsa tampered = new RouterLsa(lsa.header(), lsa.flags(), List.of(
        new RouterLink(Ipv4Address.parse("10.0.12.0"), Ipv4Address.parse("255.255.255.252"), RouterLinkType.STUB,
            11)));

    assertFalse(LsaChecksum.verify(tampered));
  }

  @Test
  void checksumRejectsShortBuffers() {
    assertThrows(IllegalArgumentException.class, () -> LsaChecksum.compute(new byte[LsaHeader.BYTES - 1]));
  }

  private static LsaHeader header(int sequence, int checksum, int age) {
    return new LsaHeader(age, OspfConstants.OPTIONS_E, LsaType.ROUTER.code(), RID, RID, sequence, checksum, 36);
  }
}
