package com.factory.edge.connector;

@FunctionalInterface
public interface DataChangeListener {

    void onDataChange(DataChange change);
}
