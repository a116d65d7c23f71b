package io.b2mash.b2b.checkinmonitor.person;

public enum Role {
  WORKER,
  TEAM_LEAD,
  SUPERVISOR,
  WHS,
  ADMIN
}
