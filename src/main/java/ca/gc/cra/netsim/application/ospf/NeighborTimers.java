package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.application.port.Cancellable;

/**
 * Timer handles owned by one neighbor. Replacing a handle cancels the previous task.
 */
final class NeighborTimers {
  private Cancellable inactivity = Cancellable.NONE;
  private Cancellable ddRetransmit = Cancellable.NONE;
  private Cancellable lsrRetransmit = Cancellable.NONE;
  private Cancellable lsuRetransmit = Cancellable.NONE;

  void replaceInactivity(Cancellable next) {
    inactivity.cancel();
    inactivity = next;
  }

  void replaceDdRetransmit(Cancellable next) {
    ddRetransmit.cancel();
    ddRetransmit = next;
  }

  void replaceLsrRetransmit(Cancellable next) {
    lsrRetransmit.cancel();
    lsrRetransmit = next;
  }

  void replaceLsuRetransmit(Cancellable next) {
    lsuRetransmit.cancel();
    lsuRetransmit = next;
  }

  boolean lsuRetransmitActive() {
    return !lsuRetransmit.isCancelled();
  }

  void cancelDdRetransmit() {
    replaceDdRetransmit(Cancellable.NONE);
  }

  void cancelLsrRetransmit() {
    replaceLsrRetransmit(Cancellable.NONE);
  }

  void cancelLsuRetransmit() {
    replaceLsuRetransmit(Cancellable.NONE);
  }

  void cancelExchange() {
    cancelDdRetransmit();
    cancelLsrRetransmit();
    cancelLsuRetransmit();
  }

  void cancelAll() {
    cancelExchange();
    replaceInactivity(Cancellable.NONE);
  }
}
