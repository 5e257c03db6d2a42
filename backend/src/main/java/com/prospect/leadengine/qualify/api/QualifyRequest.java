package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.model.Lead;

import java.util.List;

public record QualifyRequest(
    List<Lead> leads,
    Boolean enrich
) {
}
