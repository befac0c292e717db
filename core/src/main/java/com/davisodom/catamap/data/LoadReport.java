package com.davisodom.catamap.data;

/**
 * Outcome of loading and resolving a content database.
 * Individual failures are logged where they happen; this only carries the totals.
 */
public class LoadReport {
    
    private int filesTotal;
    private int filesFailed;
    private int definitionsStored;
    private int untyped;
    private int collisions;
    private int schemaWarnings;
    private int resolved;
    private int missingParents;
    private int cycles;
    
    void fileSeen() { filesTotal++; }
    void fileFailed() { filesFailed++; }
    void definitionStored() { definitionsStored++; }
    void untypedSkipped() { untyped++; }
    void collision() { collisions++; }
    void schemaWarning() { schemaWarnings++; }
    void resolved() { resolved++; }
    void missingParent() { missingParents++; }
    void cycle() { cycles++; }
    
    public int getFilesTotal() { return filesTotal; }
    public int getFilesFailed() { return filesFailed; }
    /**
     * Distinct definitions held after load. Redefinitions of an existing id are
     * counted as collisions only.
     */
    public int getDefinitionsStored() { return definitionsStored; }
    public int getUntyped() { return untyped; }
    public int getCollisions() { return collisions; }
    public int getSchemaWarnings() { return schemaWarnings; }
    public int getResolved() { return resolved; }
    public int getMissingParents() { return missingParents; }
    public int getCycles() { return cycles; }
    
    /**
     * True when every file parsed. Data problems inside parsed files do not count.
     */
    public boolean isSuccess() {
        return filesFailed == 0;
    }
    
    @Override
    public String toString() {
        return String.format("LoadReport[files=%d failed=%d stored=%d untyped=%d collisions=%d " +
                "schemaWarnings=%d resolved=%d missingParents=%d cycles=%d]",
                filesTotal, filesFailed, definitionsStored, untyped, collisions,
                schemaWarnings, resolved, missingParents, cycles);
    }
}
