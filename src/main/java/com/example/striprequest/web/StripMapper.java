package com.example.striprequest.web;

import com.example.striprequest.dto.StripSubmissionRequest;
import com.example.striprequest.model.ProbeTarget;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface StripMapper {

    @Mapping(target = "tls", source = "tls", defaultValue = "true")
    ProbeTarget toTarget(StripSubmissionRequest request);
}
