/**
 * Document text extraction backed by Apache PDFBox.
 */
package br.rio.confere.infrastructure.text;
