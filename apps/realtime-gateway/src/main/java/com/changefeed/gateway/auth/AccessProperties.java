package com.changefeed.gateway.auth;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changefeed.access")
public class AccessProperties {
  private String clientId = "changefeed-gateway";
  private List<String> bypassRoles = new ArrayList<>(List.of("ADMIN"));
  private boolean allowUnlistedChannels = false;
  private List<String> attributeClaims = new ArrayList<>();
  private Map<String, ChannelRule> channels = new LinkedHashMap<>();

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public List<String> getBypassRoles() {
    return bypassRoles;
  }

  public void setBypassRoles(List<String> bypassRoles) {
    this.bypassRoles = bypassRoles;
  }

  public boolean isAllowUnlistedChannels() {
    return allowUnlistedChannels;
  }

  public void setAllowUnlistedChannels(boolean allowUnlistedChannels) {
    this.allowUnlistedChannels = allowUnlistedChannels;
  }

  public List<String> getAttributeClaims() {
    return attributeClaims;
  }

  public void setAttributeClaims(List<String> attributeClaims) {
    this.attributeClaims = attributeClaims;
  }

  public Map<String, ChannelRule> getChannels() {
    return channels;
  }

  public void setChannels(Map<String, ChannelRule> channels) {
    this.channels = channels;
  }

  public static class ChannelRule {
    private List<String> requiredRoles = new ArrayList<>();
    private String ownerColumn;
    private String ownerClaim = "sub";

    public List<String> getRequiredRoles() {
      return requiredRoles;
    }

    public void setRequiredRoles(List<String> requiredRoles) {
      this.requiredRoles = requiredRoles;
    }

    public String getOwnerColumn() {
      return ownerColumn;
    }

    public void setOwnerColumn(String ownerColumn) {
      this.ownerColumn = ownerColumn;
    }

    public String getOwnerClaim() {
      return ownerClaim;
    }

    public void setOwnerClaim(String ownerClaim) {
      this.ownerClaim = ownerClaim;
    }
  }
}
