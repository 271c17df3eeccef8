package com.cdm.modelgraph.exception;

import com.cdm.modelgraph.model.DriverCategory;
import lombok.Getter;

@Getter
public class DriverNotFoundException extends ModelGraphException {

    private final DriverCategory category;
    private final String driverName;

    public DriverNotFoundException(DriverCategory category, String driverName) {
        super(category.getLabel() + " '" + driverName + "' does not exist");
        this.category = category;
        this.driverName = driverName;
    }
}
