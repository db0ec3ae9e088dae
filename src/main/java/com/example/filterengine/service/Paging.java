package com.example.filterengine.service;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class Paging {
    int page;
    int pageSize;
}
