package io.b2mash.yahrzeit.integration.messaging;

import io.b2mash.yahrzeit.integration.SendResult;

/** Port for posting a text message to a pre-provisioned group on a messaging service. */
public interface GroupMessageProvider {

  String providerId();

  SendResult send(String groupHandle, String text);
}
