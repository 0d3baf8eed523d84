package buzzscope.model.service.monitor;

public enum MonitorPhase { IDLE, CHECKING, NOTIFYING }
