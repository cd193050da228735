package com.changefeed.gateway.api;

import com.changefeed.gateway.auth.JwtClaimsMapper;
import com.changefeed.gateway.snapshot.SnapshotResponse;
import com.changefeed.gateway.snapshot.SnapshotService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Baseline reads for clients that have to (re)build local state before subscribing. */
@RestController
@RequestMapping("/v1/snapshots")
public class SnapshotController {
  private final SnapshotService snapshotService;
  private final JwtClaimsMapper claimsMapper;

  public SnapshotController(SnapshotService snapshotService, JwtClaimsMapper claimsMapper) {
    this.snapshotService = snapshotService;
    this.claimsMapper = claimsMapper;
  }

  @GetMapping("/{channel}")
  public SnapshotResponse snapshot(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable String channel,
      @RequestParam(required = false) Integer limit) {
    return snapshotService.read(claimsMapper.toAccessClaims(jwt), channel, limit);
  }
}
