package io.b2mash.b2b.checkinmonitor.schedule;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.DayOfWeek;
import java.util.Set;

/**
 * Maps a {@code work_days} column to a day set. Malformed column values read as null, which the
 * schedule resolver treats as "not set".
 */
@Converter
public class WorkDaysConverter implements AttributeConverter<Set<DayOfWeek>, String> {

  @Override
  public String convertToDatabaseColumn(Set<DayOfWeek> attribute) {
    return WorkDays.format(attribute);
  }

  @Override
  public Set<DayOfWeek> convertToEntityAttribute(String dbData) {
    return WorkDays.parse(dbData);
  }
}
