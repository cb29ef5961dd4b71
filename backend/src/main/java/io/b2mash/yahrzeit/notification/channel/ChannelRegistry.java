package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.recipient.ChannelKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Looks up the channel bean for a {@link ChannelKind}; one bean per kind. */
@Component
public class ChannelRegistry {

  private final Map<ChannelKind, NotificationChannel> channels = new EnumMap<>(ChannelKind.class);

  public ChannelRegistry(List<NotificationChannel> channels) {
    for (var channel : channels) {
      var previous = this.channels.putIfAbsent(channel.kind(), channel);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate channels for "
                + channel.kind()
                + ": "
                + previous.getClass().getSimpleName()
                + " and "
                + channel.getClass().getSimpleName());
      }
    }
  }

  public NotificationChannel get(ChannelKind kind) {
    var channel = channels.get(kind);
    if (channel == null) {
      throw new IllegalStateException("No channel registered for " + kind);
    }
    return channel;
  }
}
