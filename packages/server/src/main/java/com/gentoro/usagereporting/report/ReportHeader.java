package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.usagereporting.logging.LoggingService;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;

/** Identifies the reporting process and the schema a report is about. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReportHeader {
  private static final Logger log = LoggingService.getLogger(ReportHeader.class);

  public static final String AGENT_NAME = "usage-reporting-java";

  @JsonProperty("graphRef")
  private String graphRef;

  @JsonProperty("hostname")
  private String hostname;

  @JsonProperty("agentVersion")
  private String agentVersion;

  @JsonProperty("runtimeVersion")
  private String runtimeVersion;

  @JsonProperty("uname")
  private String uname;

  @JsonProperty("executableSchemaId")
  private String executableSchemaId;

  public ReportHeader() {}

  /** Header for this process, with host and runtime fields filled in. */
  public static ReportHeader forSchema(String graphRef, String executableSchemaId) {
    ReportHeader header = new ReportHeader();
    header.graphRef = graphRef;
    header.executableSchemaId = executableSchemaId;
    header.hostname = ProcessInfo.HOSTNAME;
    header.agentVersion = ProcessInfo.AGENT_VERSION;
    header.runtimeVersion = ProcessInfo.RUNTIME_VERSION;
    header.uname = ProcessInfo.UNAME;
    return header;
  }

  public String getGraphRef() {
    return graphRef;
  }

  public void setGraphRef(String graphRef) {
    this.graphRef = graphRef;
  }

  public String getHostname() {
    return hostname;
  }

  public void setHostname(String hostname) {
    this.hostname = hostname;
  }

  public String getAgentVersion() {
    return agentVersion;
  }

  public void setAgentVersion(String agentVersion) {
    this.agentVersion = agentVersion;
  }

  public String getRuntimeVersion() {
    return runtimeVersion;
  }

  public void setRuntimeVersion(String runtimeVersion) {
    this.runtimeVersion = runtimeVersion;
  }

  public String getUname() {
    return uname;
  }

  public void setUname(String uname) {
    this.uname = uname;
  }

  public String getExecutableSchemaId() {
    return executableSchemaId;
  }

  public void setExecutableSchemaId(String executableSchemaId) {
    this.executableSchemaId = executableSchemaId;
  }

  private static final class ProcessInfo {
    static final String HOSTNAME = hostname();
    static final String AGENT_VERSION = AGENT_NAME + "@" + agentVersion();
    static final String RUNTIME_VERSION = "java " + Runtime.version();
    static final String UNAME =
        System.getProperty("os.name")
            + ", "
            + System.getProperty("os.version")
            + ", "
            + System.getProperty("os.arch");

    private static String hostname() {
      try {
        return InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException e) {
        String fromEnv = System.getenv("HOSTNAME");
        log.debug("Local host name not resolvable ({}), using '{}'", e.getMessage(), fromEnv);
        return fromEnv == null ? "" : fromEnv;
      }
    }

    private static String agentVersion() {
      String version = ReportHeader.class.getPackage().getImplementationVersion();
      return version == null ? "dev" : version;
    }
  }
}
