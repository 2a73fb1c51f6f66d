package com.codeheadsystems.hivemind.server.gossip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.hivemind.server.config.HivemindServerConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class GossipAuthorizerTest {

  @Test
  void noSecret_isOpen() {
    GossipAuthorizer authorizer = new GossipAuthorizer(HivemindServerConfig.defaults("h1"));

    assertThat(authorizer.isOpen()).isTrue();
    assertThatCode(() -> authorizer.authorize(null)).doesNotThrowAnyException();
  }

  @Test
  void secret_mustMatchExactly() {
    GossipAuthorizer authorizer = new GossipAuthorizer(
        HivemindServerConfig.defaults("h1").withGossip(List.of(), "s3cret"));

    assertThatCode(() -> authorizer.authorize("s3cret")).doesNotThrowAnyException();
    assertThatThrownBy(() -> authorizer.authorize("s3cre")).isInstanceOf(SecurityException.class);
    assertThatThrownBy(() -> authorizer.authorize(null)).isInstanceOf(SecurityException.class);
    assertThatThrownBy(() -> authorizer.authorize("")).isInstanceOf(SecurityException.class);
  }
}
