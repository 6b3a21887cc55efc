package com.pagecraft.service.responsive;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties("designer.responsive")
public class ResponsiveConfiguration {

    private CascadeOrder order = CascadeOrder.MOBILE_FIRST;
    private int gridColumns = 12;
    private List<String> gridTypes = List.of("col");

    public CascadeOrder getOrder() { return order; }
    public void setOrder(CascadeOrder order) { this.order = order; }

    public int getGridColumns() { return gridColumns; }
    public void setGridColumns(int gridColumns) { this.gridColumns = gridColumns; }

    /** Component types whose span takes part in grid overflow checks. */
    public List<String> getGridTypes() { return gridTypes; }
    public void setGridTypes(List<String> gridTypes) { this.gridTypes = List.copyOf(gridTypes); }
}
