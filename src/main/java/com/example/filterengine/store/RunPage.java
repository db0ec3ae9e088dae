package com.example.filterengine.store;

import com.example.filterengine.model.FilterRun;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class RunPage {
    List<FilterRun> runs;
    long total;
    int page;
    int pageSize;
}
