package com.codeheadsystems.tollgate.springboot.testapp;

import com.codeheadsystems.tollgate.springboot.security.TollgatePrincipal;
import java.util.Map;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/whoami")
public class WhoAmIController {

  @GetMapping
  public Map<String, String> whoAmI(@AuthenticationPrincipal TollgatePrincipal principal) {
    return Map.of("accountId", principal.accountId(), "username", principal.username());
  }
}
