package io.ussopmm.ems.query.mapper;

import io.ussopmm.ems.model.Reading;
import io.ussopmm.ems.store.StorageRecord;
import org.mapstruct.InjectionStrategy;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import static org.mapstruct.MappingConstants.ComponentModel.SPRING;

@Mapper(componentModel = SPRING, injectionStrategy = InjectionStrategy.CONSTRUCTOR)
public interface ReadingMapper {

    @Mapping(target = "sensorType", source = "partitionKey")
    @Mapping(target = "timestamp", source = "sortKey", qualifiedByName = "isoSeconds")
    @Mapping(target = "values", source = "payload")
    Reading from(StorageRecord record);

    @Named("isoSeconds")
    default String isoSeconds(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
