package com.questrail.testtree.api;

/**
 * Body of a reporting-only section nested inside a case.
 */
@FunctionalInterface
public interface SectionBody
{
    void run(CaseContext context) throws Exception;
}
