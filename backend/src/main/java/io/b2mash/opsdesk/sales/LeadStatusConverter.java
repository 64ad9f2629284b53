package io.b2mash.opsdesk.sales;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/** Binds {@code ?status=contacted} query parameters to {@link LeadStatus}. */
@Component
public class LeadStatusConverter implements Converter<String, LeadStatus> {

  @Override
  public LeadStatus convert(String source) {
    return LeadStatus.fromWire(source);
  }
}
